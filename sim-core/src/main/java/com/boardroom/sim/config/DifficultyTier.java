package com.boardroom.sim.config;

/**
 * Built-in difficulty tiers.
 *
 * <ul>
 *   <li>{@link #WELCH}   — easy: low retirement bar, no tenure decay, +1 success reward</li>
 *   <li>{@link #NADELLA} — regular (default): decay from quarter 16</li>
 *   <li>{@link #ICAHN}   — hard: high bar, early decay, -1 success reward</li>
 * </ul>
 */
public enum DifficultyTier {
    WELCH(new DifficultySettings("Welch", 120, false, 99, 1, 80)),
    NADELLA(new DifficultySettings("Nadella", 140, true, 16, 0, 75)),
    ICAHN(new DifficultySettings("Icahn", 180, true, 6, -1, 65));

    private final DifficultySettings settings;

    DifficultyTier(DifficultySettings settings) {
        this.settings = settings;
    }

    public DifficultySettings settings() {
        return settings;
    }

    public static DifficultyTier defaultTier() {
        return NADELLA;
    }
}
