package com.arbiter.core;

import java.util.Arrays;
import java.util.List;

/**
 * Priority tiers, ordered from most to least urgent.
 * A lower {@link #level()} means a higher priority.
 */
public enum Tier {
    CRITICAL(1),
    HIGH(2),
    NORMAL(3),
    LOW(4),
    BACKGROUND(5);

    private static final List<Tier> BY_LEVEL = List.of(values());

    private final int level;

    Tier(int level) {
        this.level = level;
    }

    /**
     * Ordinal priority level, 1 (CRITICAL) through 5 (BACKGROUND).
     */
    public int level() {
        return level;
    }

    /**
     * Whether this tier is strictly more urgent than {@code other}.
     */
    public boolean isHigherThan(Tier other) {
        return level < other.level;
    }

    /**
     * Resolve a tier from its numeric level.
     *
     * @throws IllegalArgumentException if the level is outside 1..5
     */
    public static Tier fromLevel(int level) {
        if (level < 1 || level > BY_LEVEL.size()) {
            throw new IllegalArgumentException("Unknown priority level: " + level);
        }
        return BY_LEVEL.get(level - 1);
    }

    /**
     * Resolve a tier from a configuration name ("critical", "HIGH", "background").
     */
    public static Tier fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tier name cannot be blank");
        }
        String normalized = name.trim().toUpperCase().replace("-", "_");
        return Arrays.stream(values())
                .filter(t -> t.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown tier: " + name));
    }
}
