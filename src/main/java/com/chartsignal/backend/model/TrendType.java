package com.chartsignal.backend.model;

/**
 * Seven ordered trend states. The score is used when per-timeframe trends
 * are combined into a weighted overall trend.
 */
public enum TrendType {
    STRONG_UPTREND(3),
    UPTREND(2),
    WEAK_UPTREND(1),
    RANGING(0),
    WEAK_DOWNTREND(-1),
    DOWNTREND(-2),
    STRONG_DOWNTREND(-3);

    private final int score;

    TrendType(int score) {
        this.score = score;
    }

    public int getScore() {
        return score;
    }

    public boolean isUp() {
        return score > 0;
    }

    public boolean isDown() {
        return score < 0;
    }

    public boolean isStrong() {
        return Math.abs(score) == 3;
    }

    public static TrendType fromWeightedScore(double weightedScore) {
        if (weightedScore >= 2.5) return STRONG_UPTREND;
        if (weightedScore >= 1.5) return UPTREND;
        if (weightedScore >= 0.5) return WEAK_UPTREND;
        if (weightedScore <= -2.5) return STRONG_DOWNTREND;
        if (weightedScore <= -1.5) return DOWNTREND;
        if (weightedScore <= -0.5) return WEAK_DOWNTREND;
        return RANGING;
    }
}
