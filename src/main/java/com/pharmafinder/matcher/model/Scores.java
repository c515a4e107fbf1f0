package com.pharmafinder.matcher.model;

public final class Scores {

    private Scores() {
    }

    /**
     * Clamps a score into [0, 1]; NaN becomes 0.
     */
    public static double clamp(double score) {
        if (Double.isNaN(score) || score <= 0.0) {
            return 0.0;
        }
        return Math.min(1.0, score);
    }
}
