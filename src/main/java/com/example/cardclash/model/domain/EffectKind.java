package com.example.cardclash.model.domain;

public enum EffectKind {
    POWER_CHANGE,   // magnitude added to every side of each target, temporary when duration > 0
    DRAW_CARD,      // the ability owner draws magnitude cards
    FLIP_TARGETS,   // targets change owner to the ability owner
    GRANT_IMMUNITY, // targets cannot be flipped by combat
    CURSE_TILES,    // empty targets become cursed tiles
    BLESS_TILES,    // empty targets become blessed tiles
    BLOCK_TILES,    // empty targets cannot be played on
    END_MATCH       // the ability owner wins immediately
}
