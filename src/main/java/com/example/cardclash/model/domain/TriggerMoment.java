package com.example.cardclash.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A named point in the turn lifecycle at which card abilities may run.
 * <p>
 * Moments are open-ended tags: card data may carry situational moments beyond the
 * constants declared here, and the ability registry dispatches on whatever tag it is handed.
 */
public final class TriggerMoment {

    public static final TriggerMoment ON_PLACE = new TriggerMoment("OnPlace");
    public static final TriggerMoment ON_FLIP = new TriggerMoment("OnFlip");
    public static final TriggerMoment ON_FLIPPED = new TriggerMoment("OnFlipped");
    public static final TriggerMoment ON_TURN_START = new TriggerMoment("OnTurnStart");
    public static final TriggerMoment ON_TURN_END = new TriggerMoment("OnTurnEnd");
    public static final TriggerMoment ON_ROUND_START = new TriggerMoment("OnRoundStart");
    public static final TriggerMoment ON_ROUND_END = new TriggerMoment("OnRoundEnd");

    private final String name;

    private TriggerMoment(String name) {
        this.name = name;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TriggerMoment of(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Trigger moment name must not be blank");
        }
        return new TriggerMoment(name.trim());
    }

    @JsonValue
    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TriggerMoment other)) return false;
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
