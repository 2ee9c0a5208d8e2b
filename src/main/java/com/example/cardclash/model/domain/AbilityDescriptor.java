package com.example.cardclash.model.domain;

import java.util.Set;

public record AbilityDescriptor(String name, Set<TriggerMoment> triggers, AbilityEffect effect) {

    public AbilityDescriptor {
        triggers = triggers == null ? Set.of() : Set.copyOf(triggers);
    }

    public boolean firesOn(TriggerMoment moment) {
        return effect != null && triggers.contains(moment);
    }
}
