package com.example.cardclash;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@EnableAsync
@SpringBootApplication
public class CardClashApplication {

    public static void main(String[] args) {
        SpringApplication.run(CardClashApplication.class, args);
    }

}
