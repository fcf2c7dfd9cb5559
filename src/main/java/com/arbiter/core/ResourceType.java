package com.arbiter.core;

/**
 * The five independently accounted resource quantities.
 */
public enum ResourceType {
    CONNECTIONS("connections"),
    BANDWIDTH("bandwidth-kbps"),
    CONCURRENCY("concurrency"),
    DISK_IO("disk-io-mbps"),
    MEMORY("memory-mb");

    private final String key;

    ResourceType(String key) {
        this.key = key;
    }

    /**
     * Key used for this quantity in configuration files and requirement overrides.
     */
    public String key() {
        return key;
    }

    public static ResourceType fromKey(String key) {
        for (ResourceType type : values()) {
            if (type.key.equals(key) || type.name().equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown resource type: " + key);
    }
}
