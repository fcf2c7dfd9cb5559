package com.arbiter.display;

import com.arbiter.core.Tier;

import java.util.EnumMap;
import java.util.Map;

/**
 * Display names and colours for tiers, for dashboards and log output.
 * Nothing in the scheduling core depends on this class.
 */
public final class TierLabels {

    private static final Map<Tier, Label> LABELS = new EnumMap<>(Tier.class);

    static {
        LABELS.put(Tier.CRITICAL, new Label("Critical", "red"));
        LABELS.put(Tier.HIGH, new Label("High", "orange"));
        LABELS.put(Tier.NORMAL, new Label("Normal", "blue"));
        LABELS.put(Tier.LOW, new Label("Low", "green"));
        LABELS.put(Tier.BACKGROUND, new Label("Background", "gray"));
    }

    private TierLabels() {
    }

    public static String displayName(Tier tier) {
        return tier != null ? LABELS.get(tier).displayName() : "Unknown";
    }

    public static String color(Tier tier) {
        return tier != null ? LABELS.get(tier).color() : "default";
    }

    /**
     * Label for a numeric level; levels outside 1..5 render as "Unknown".
     */
    public static String displayName(int level) {
        if (level < 1 || level > Tier.values().length) {
            return "Unknown";
        }
        return displayName(Tier.fromLevel(level));
    }

    private record Label(String displayName, String color) {}
}
