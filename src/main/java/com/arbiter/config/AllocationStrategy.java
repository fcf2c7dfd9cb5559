package com.arbiter.config;

import com.arbiter.core.Tier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-tier quota table. Each tier's percentages are evaluated independently
 * against the global caps; they are not required to sum to 100.
 */
public final class AllocationStrategy {

    private final Map<Tier, TierQuota> quotas;

    public AllocationStrategy(Map<Tier, TierQuota> quotas) {
        EnumMap<Tier, TierQuota> copy = new EnumMap<>(Tier.class);
        copy.putAll(quotas);
        for (Tier tier : Tier.values()) {
            if (!copy.containsKey(tier)) {
                throw new IllegalArgumentException("Allocation strategy is missing tier " + tier);
            }
        }
        this.quotas = Collections.unmodifiableMap(copy);
    }

    /**
     * Default shares: CRITICAL 40/50/50/40/40, HIGH 30, NORMAL 20/15/15/20/20,
     * LOW 8/4/4/8/8, BACKGROUND 2/1/1/2/2.
     */
    public static AllocationStrategy defaults() {
        Map<Tier, TierQuota> map = new EnumMap<>(Tier.class);
        map.put(Tier.CRITICAL, new TierQuota(40, 50, 50, 40, 40));
        map.put(Tier.HIGH, TierQuota.uniform(30));
        map.put(Tier.NORMAL, new TierQuota(20, 15, 15, 20, 20));
        map.put(Tier.LOW, new TierQuota(8, 4, 4, 8, 8));
        map.put(Tier.BACKGROUND, new TierQuota(2, 1, 1, 2, 2));
        return new AllocationStrategy(map);
    }

    public TierQuota quota(Tier tier) {
        return quotas.get(tier);
    }

    public Map<Tier, TierQuota> asMap() {
        return quotas;
    }

    /**
     * Copy with the given tiers replaced; tiers not mentioned keep their quota.
     */
    public AllocationStrategy merge(Map<Tier, TierQuota> updates) {
        EnumMap<Tier, TierQuota> merged = new EnumMap<>(quotas);
        merged.putAll(updates);
        return new AllocationStrategy(merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AllocationStrategy that)) return false;
        return quotas.equals(that.quotas);
    }

    @Override
    public int hashCode() {
        return quotas.hashCode();
    }

    @Override
    public String toString() {
        return "AllocationStrategy" + quotas;
    }
}
