package com.example.cardclash.config;

import com.example.cardclash.logic.ai.AiDifficulty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the match server, bound from {@code cardclash.*} in application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "cardclash")
public class CardClashProperties {

    private Engine engine = new Engine();
    private Cards cards = new Cards();
    private Session session = new Session();
    private Ai ai = new Ai();
    private Matchmaking matchmaking = new Matchmaking();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Engine {
        private int boardSize = 4;
        private int maxHandSize = 5;
        private int initialHandSize = 5;
    }

    @Data
    public static class Cards {
        /** Power added to every side for each level above 1. */
        private int levelBonusPerLevel = 1;
    }

    @Data
    public static class Session {
        /**
         * Allowed turn length indexed by the player's strike count. The last entry is the floor.
         */
        private List<Integer> turnDurationsSeconds = new ArrayList<>(List.of(30, 15, 10, 5));
        private int graceSeconds = 15;
        private int joinTimeoutSeconds = 60;
    }

    @Data
    public static class Ai {
        private AiDifficulty timeoutDifficulty = AiDifficulty.MEDIUM;
    }

    @Data
    public static class Matchmaking {
        private int minDeckSize = 10;
    }

    @Data
    public static class Scheduler {
        private int poolSize = 4;
    }
}
