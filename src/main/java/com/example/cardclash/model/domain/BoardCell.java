package com.example.cardclash.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One square of the board. An empty cell has no {@code cardInstanceId}; it may still carry a
 * {@link TileEffect}. Flipping changes {@code ownerId} only.
 */
@Data
@NoArgsConstructor
public class BoardCell {
    private String ownerId;
    private String cardInstanceId;
    private Power power;
    private int level;
    private CellState state = CellState.NORMAL;
    private int stateTurnsLeft; // 0 = state does not expire
    private TileEffect tileEffect;
    private List<TemporaryEffect> temporaryEffects = new ArrayList<>();

    public void place(String ownerId, InGameCard card) {
        this.ownerId = ownerId;
        this.cardInstanceId = card.instanceId();
        this.power = card.currentPower();
        this.level = card.level();
        this.state = CellState.NORMAL;
        this.stateTurnsLeft = 0;
        this.temporaryEffects = new ArrayList<>();
    }

    @JsonIgnore
    public boolean isOccupied() {
        return cardInstanceId != null;
    }

    @JsonIgnore
    public boolean isBlocked() {
        return tileEffect != null && tileEffect.status() == TileStatus.BLOCKED;
    }

    @JsonIgnore
    public boolean isImmune() {
        return state == CellState.IMMUNE;
    }

    public BoardCell copy() {
        BoardCell copy = new BoardCell();
        copy.ownerId = ownerId;
        copy.cardInstanceId = cardInstanceId;
        copy.power = power;
        copy.level = level;
        copy.state = state;
        copy.stateTurnsLeft = stateTurnsLeft;
        copy.tileEffect = tileEffect;
        copy.temporaryEffects = new ArrayList<>(temporaryEffects);
        return copy;
    }
}
