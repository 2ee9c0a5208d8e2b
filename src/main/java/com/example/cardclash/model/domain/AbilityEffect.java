package com.example.cardclash.model.domain;

/**
 * Structured parameters of an ability. Handlers are looked up by {@link #kind()}.
 */
public record AbilityEffect(EffectKind kind,
                            EffectCondition condition,
                            int magnitude,
                            int duration,
                            TargetScope target) {

    public AbilityEffect {
        if (kind == null) {
            throw new IllegalArgumentException("Ability effect needs a kind");
        }
        if (condition == null) {
            condition = EffectCondition.ALWAYS;
        }
        if (target == null) {
            target = TargetScope.SELF;
        }
    }
}
