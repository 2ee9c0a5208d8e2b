package com.example.cardclash.service;

import com.example.cardclash.common.GamePersistenceException;
import com.example.cardclash.model.domain.GameState;
import com.example.cardclash.model.domain.GameStatus;
import com.example.cardclash.model.entity.GameEntity;
import com.example.cardclash.repository.GameRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes game states by match id. Writes are synchronous: the session layer only
 * applies a new state after it has been stored.
 */
@Slf4j
@Service
public class GamePersistenceService {

    private final GameRepository gameRepository;
    private final ObjectMapper objectMapper;

    public GamePersistenceService(GameRepository gameRepository, ObjectMapper objectMapper) {
        this.gameRepository = gameRepository;
        // Lenient copy so states written by older versions still load
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @throws GamePersistenceException if the state could not be serialized or stored
     */
    @Transactional
    public void save(GameState state) {
        try {
            GameEntity entity = gameRepository.findById(state.getMatchId()).orElseGet(GameEntity::new);
            if (entity.getId() == null) {
                entity.setId(state.getMatchId());
            }
            entity.setPlayer1Id(state.getPlayer1().getUserId());
            entity.setPlayer2Id(state.getPlayer2().getUserId());
            entity.setStatus(statusColumn(state.getStatus()));
            entity.setTurnNumber(state.getTurnNumber());
            entity.setPlayer1Score(state.getPlayer1().getScore());
            entity.setPlayer2Score(state.getPlayer2().getScore());

            if (!state.isActive()) {
                entity.setWinnerId(state.getWinnerId());
                entity.setEndReason(state.getTerminationReason() == null ? null
                        : state.getTerminationReason().name().toLowerCase());
                if (entity.getCreatedAt() != null) {
                    entity.setDurationSeconds(Duration.between(entity.getCreatedAt(), LocalDateTime.now()).getSeconds());
                }
            }

            entity.setGameStateJson(objectMapper.writeValueAsString(state));
            gameRepository.save(entity);
        } catch (JsonProcessingException e) {
            throw new GamePersistenceException("Could not serialize match " + state.getMatchId(), e);
        } catch (RuntimeException e) {
            throw new GamePersistenceException("Could not save match " + state.getMatchId(), e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<GameState> load(String matchId) {
        return gameRepository.findById(matchId).map(this::read);
    }

    /**
     * States of matches that were still running when the server last stopped.
     */
    @Transactional(readOnly = true)
    public List<GameState> loadActiveGames() {
        List<GameState> games = new ArrayList<>();
        for (GameEntity entity : gameRepository.findByStatus(statusColumn(GameStatus.ACTIVE))) {
            try {
                games.add(read(entity));
            } catch (GamePersistenceException e) {
                log.error("Skipping unreadable match {}", entity.getId(), e);
            }
        }
        return games;
    }

    private GameState read(GameEntity entity) {
        try {
            return objectMapper.readValue(entity.getGameStateJson(), GameState.class);
        } catch (JsonProcessingException e) {
            throw new GamePersistenceException("Stored state of match " + entity.getId() + " is unreadable", e);
        }
    }

    static String statusColumn(GameStatus status) {
        return status.name().toLowerCase();
    }
}
