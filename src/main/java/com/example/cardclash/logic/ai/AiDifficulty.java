package com.example.cardclash.logic.ai;

/**
 * How many of the best-scored candidates the AI picks from.
 */
public enum AiDifficulty {
    HARD(1),
    MEDIUM(3),
    EASY(5);

    private final int candidatePool;

    AiDifficulty(int candidatePool) {
        this.candidatePool = candidatePool;
    }

    public int candidatePool() {
        return candidatePool;
    }
}
