package com.arbiter.config;

import com.arbiter.core.ResourceType;
import com.arbiter.core.Tier;
import com.arbiter.exception.ConfigurationException;
import com.arbiter.scheduler.SchedulingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Loads arbiter configuration from YAML files.
 * <p>
 * Every recognised key is listed below; anything else is rejected so that a
 * misspelt option fails at startup instead of being silently ignored.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Set<String> ROOT_KEYS = Set.of(
            "name", "scheduler", "system-resources", "allocation-strategy");

    private static final Set<String> SCHEDULER_KEYS = Set.of(
            "tick-interval-ms", "starvation-threshold-ms", "preemption-enabled",
            "max-preemptions-per-minute", "policy", "max-consecutive-failures",
            "failure-backoff-ms", "unsatisfiable-tasks");

    private static final Set<String> SYSTEM_RESOURCE_KEYS = Set.of(
            "max-connections", "max-bandwidth-kbps", "max-concurrency", "max-disk-io-mbps", "max-memory-mb");

    private static final Set<String> QUOTA_KEYS = Set.of(
            "connections-percent", "bandwidth-percent", "concurrency-percent", "disk-io-percent", "memory-percent");

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static ArbiterConfig load(String path) {
        log.info("Loading arbiter configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static ArbiterConfig parseYaml(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Configuration is not a valid YAML mapping", e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The arbiter section may sit at the root or under an 'arbiter' key
        Map<String, Object> arbiterMap = root.containsKey("arbiter")
                ? section(root, "arbiter")
                : root;
        if (root.containsKey("arbiter") && root.size() > 1) {
            rejectUnknown("root", root, Set.of("arbiter"));
        }
        rejectUnknown("arbiter", arbiterMap, ROOT_KEYS);

        String name = getString(arbiterMap, "name", "arbiter");
        SchedulerConfig scheduler = parseScheduler(section(arbiterMap, "scheduler"));
        SystemResources systemResources = parseSystemResources(section(arbiterMap, "system-resources"));
        AllocationStrategy strategy = parseAllocationStrategy(section(arbiterMap, "allocation-strategy"));

        warnOnOversubscription(strategy);

        ArbiterConfig config = new ArbiterConfig(name, scheduler, systemResources, strategy);
        log.info("Loaded arbiter configuration '{}': policy={}, tick={}ms, starvation={}ms, preemption={} ({}/min)",
                name, scheduler.policy(), scheduler.tickIntervalMs(), scheduler.starvationThresholdMs(),
                scheduler.preemptionEnabled(), scheduler.maxPreemptionsPerMinute());
        return config;
    }

    private static SchedulerConfig parseScheduler(Map<String, Object> map) {
        SchedulerConfig defaults = SchedulerConfig.defaults();
        if (map == null) {
            return defaults;
        }
        rejectUnknown("scheduler", map, SCHEDULER_KEYS);

        try {
            return new SchedulerConfig(
                    getLong(map, "tick-interval-ms", defaults.tickIntervalMs()),
                    getLong(map, "starvation-threshold-ms", defaults.starvationThresholdMs()),
                    getBoolean(map, "preemption-enabled", defaults.preemptionEnabled()),
                    getInt(map, "max-preemptions-per-minute", defaults.maxPreemptionsPerMinute()),
                    SchedulingPolicy.fromName(getString(map, "policy", defaults.policy().name())),
                    getInt(map, "max-consecutive-failures", defaults.maxConsecutiveFailures()),
                    getLong(map, "failure-backoff-ms", defaults.failureBackoffMs()),
                    UnsatisfiableTaskPolicy.valueOf(
                            getString(map, "unsatisfiable-tasks", defaults.unsatisfiableTasks().name())
                                    .trim().toUpperCase())
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid scheduler configuration: " + e.getMessage(), e);
        }
    }

    private static SystemResources parseSystemResources(Map<String, Object> map) {
        SystemResources defaults = SystemResources.defaults();
        if (map == null) {
            return defaults;
        }
        rejectUnknown("system-resources", map, SYSTEM_RESOURCE_KEYS);

        try {
            return new SystemResources(
                    getInt(map, "max-connections", defaults.maxConnections()),
                    getInt(map, "max-bandwidth-kbps", defaults.maxBandwidthKbps()),
                    getInt(map, "max-concurrency", defaults.maxConcurrency()),
                    getInt(map, "max-disk-io-mbps", defaults.maxDiskIoMbps()),
                    getInt(map, "max-memory-mb", defaults.maxMemoryMb())
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid system-resources configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Tiers omitted from the file keep their default quota, as do omitted percentages.
     */
    private static AllocationStrategy parseAllocationStrategy(Map<String, Object> map) {
        AllocationStrategy defaults = AllocationStrategy.defaults();
        if (map == null) {
            return defaults;
        }

        Map<Tier, TierQuota> updates = new EnumMap<>(Tier.class);
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            Tier tier;
            try {
                tier = Tier.fromName(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown tier in allocation-strategy: " + entry.getKey(), e);
            }
            Map<String, Object> quotaMap = section(map, entry.getKey());
            if (quotaMap == null) {
                continue;
            }
            rejectUnknown("allocation-strategy." + entry.getKey(), quotaMap, QUOTA_KEYS);

            TierQuota base = defaults.quota(tier);
            try {
                updates.put(tier, new TierQuota(
                        getInt(quotaMap, "connections-percent", base.connectionsPercent()),
                        getInt(quotaMap, "bandwidth-percent", base.bandwidthPercent()),
                        getInt(quotaMap, "concurrency-percent", base.concurrencyPercent()),
                        getInt(quotaMap, "disk-io-percent", base.diskIoPercent()),
                        getInt(quotaMap, "memory-percent", base.memoryPercent())
                ));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid quota for tier " + tier + ": " + e.getMessage(), e);
            }
        }
        return defaults.merge(updates);
    }

    /**
     * Per-tier percentages are not normalised; a total above 100 means the tiers
     * can jointly oversubscribe the global cap when all of them are saturated.
     */
    private static void warnOnOversubscription(AllocationStrategy strategy) {
        for (ResourceType type : ResourceType.values()) {
            int total = 0;
            for (TierQuota quota : strategy.asMap().values()) {
                total += quota.percent(type);
            }
            if (total > 100) {
                log.warn("Tier quotas for {} add up to {}% of system capacity; saturated tiers may oversubscribe it",
                        type.key(), total);
            }
        }
    }

    private static void rejectUnknown(String sectionName, Map<String, Object> map, Set<String> allowed) {
        for (String key : map.keySet()) {
            if (!allowed.contains(key)) {
                throw new ConfigurationException("Unknown key '" + key + "' in section '" + sectionName
                        + "'. Allowed keys: " + allowed);
            }
        }
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        throw new ConfigurationException("Section '" + key + "' must be a mapping");
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        try {
            if (value instanceof Number) return Math.toIntExact(wholeNumber(key, (Number) value));
            return Integer.parseInt(value.toString().trim());
        } catch (ArithmeticException e) {
            throw new ConfigurationException("Key '" + key + "' is out of range: " + value, e);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Key '" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return wholeNumber(key, (Number) value);
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Key '" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static long wholeNumber(String key, Number value) {
        if (value instanceof BigInteger big) {
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                throw new ConfigurationException("Key '" + key + "' is out of range: " + value, e);
            }
        }
        if (value instanceof Double || value instanceof Float) {
            throw new ConfigurationException("Key '" + key + "' must be an integer, got: " + value);
        }
        return value.longValue();
    }
}
