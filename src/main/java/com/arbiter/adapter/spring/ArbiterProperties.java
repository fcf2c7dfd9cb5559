package com.arbiter.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the arbiter.
 */
@ConfigurationProperties(prefix = "arbiter")
public class ArbiterProperties {

    /**
     * Whether the arbiter is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the arbiter configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:arbiter.yaml";

    /**
     * Whether the scheduling loop starts with the application context.
     */
    private boolean autoStart = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }
}
