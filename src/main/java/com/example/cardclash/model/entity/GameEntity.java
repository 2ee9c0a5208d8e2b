package com.example.cardclash.model.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "games")
@Data
public class GameEntity {

    @Id
    private String id; // match id

    private String player1Id;
    private String player2Id;

    private String status; // active, player1_win, player2_win, draw, aborted

    @Lob
    @Column(columnDefinition = "LONGTEXT")
    private String gameStateJson;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    // Summary columns, filled in as the match goes
    private String winnerId;
    private String endReason; // completed, surrender, disconnect, aborted
    private int turnNumber;
    private int player1Score;
    private int player2Score;
    private long durationSeconds;
}
