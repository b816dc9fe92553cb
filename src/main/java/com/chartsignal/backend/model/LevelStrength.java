package com.chartsignal.backend.model;

/**
 * Ordered level strength. The weight feeds the weighted-center merge of
 * overlapping levels; the bonus is added to a level's confidence.
 */
public enum LevelStrength {
    WEAK(1, 0),
    MEDIUM(2, 10),
    STRONG(3, 15),
    MAJOR(4, 20);

    private final int weight;
    private final int confidenceBonus;

    LevelStrength(int weight, int confidenceBonus) {
        this.weight = weight;
        this.confidenceBonus = confidenceBonus;
    }

    public int getWeight() {
        return weight;
    }

    public int getConfidenceBonus() {
        return confidenceBonus;
    }

    public static LevelStrength fromScore(int score) {
        if (score >= 8) return MAJOR;
        if (score >= 6) return STRONG;
        if (score >= 4) return MEDIUM;
        return WEAK;
    }

    public static LevelStrength stronger(LevelStrength a, LevelStrength b) {
        return a.weight >= b.weight ? a : b;
    }
}
