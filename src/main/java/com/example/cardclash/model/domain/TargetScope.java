package com.example.cardclash.model.domain;

public enum TargetScope {
    SELF,
    ADJACENT_ALLIES,
    ADJACENT_ENEMIES,
    ADJACENT_ALL,
    ADJACENT_EMPTY,
    ALL_ALLIES,
    ALL_ENEMIES,
    ALL_EMPTY
}
