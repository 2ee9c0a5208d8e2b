package com.example.cardclash.repository;

import com.example.cardclash.model.entity.DeckEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DeckRepository extends JpaRepository<DeckEntity, String> {
    Optional<DeckEntity> findByIdAndOwnerUserId(String id, String ownerUserId);
}
