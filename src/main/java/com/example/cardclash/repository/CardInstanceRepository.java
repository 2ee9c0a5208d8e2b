package com.example.cardclash.repository;

import com.example.cardclash.model.entity.CardInstanceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CardInstanceRepository extends JpaRepository<CardInstanceEntity, String> {
}
