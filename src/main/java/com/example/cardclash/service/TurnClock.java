package com.example.cardclash.service;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Turn timer bookkeeping of one match. Lives only as long as the live session, never persisted.
 * <p>
 * Each player's allowed turn length is {@code durations[strikes]}: every timeout adds a strike
 * (capped at the last entry), any action the player makes themselves clears them. Every
 * (re)arm bumps a generation number; a timer callback carrying an older generation is stale.
 */
public class TurnClock {

    private final List<Integer> durations;
    private final Map<String, Integer> strikes = new HashMap<>();

    @Getter
    @Setter
    private ScheduledFuture<?> timer;
    @Getter
    private String turnPlayerId;
    @Getter
    private Instant deadline;
    private long generation;

    public TurnClock(List<Integer> durations) {
        if (durations == null || durations.isEmpty()) {
            throw new IllegalArgumentException("At least one turn duration is required");
        }
        this.durations = List.copyOf(durations);
    }

    public int allowedSecondsFor(String playerId) {
        return durations.get(strikesOf(playerId));
    }

    public int strikesOf(String playerId) {
        return strikes.getOrDefault(playerId, 0);
    }

    public void recordTimeout(String playerId) {
        strikes.put(playerId, Math.min(strikesOf(playerId) + 1, durations.size() - 1));
    }

    public void resetStrikes(String playerId) {
        strikes.remove(playerId);
    }

    public long arm(String playerId, Instant deadline) {
        this.turnPlayerId = playerId;
        this.deadline = deadline;
        return ++generation;
    }

    public void disarm() {
        this.turnPlayerId = null;
        this.deadline = null;
        generation++;
    }

    public boolean isCurrent(long generation) {
        return deadline != null && this.generation == generation;
    }

    /**
     * Whole seconds left on the running timer, rounded up; 0 when nothing is running.
     */
    public long remainingSeconds(Instant now) {
        if (deadline == null) {
            return 0;
        }
        long millis = Duration.between(now, deadline).toMillis();
        return millis <= 0 ? 0 : (millis + 999) / 1000;
    }
}
