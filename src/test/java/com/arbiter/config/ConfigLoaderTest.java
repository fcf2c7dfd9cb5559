package com.arbiter.config;

import com.arbiter.core.Tier;
import com.arbiter.exception.ConfigurationException;
import com.arbiter.scheduler.SchedulingPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should load the bundled configuration with default values")
    void shouldLoadBundledConfiguration() {
        ArbiterConfig config = ConfigLoader.load("classpath:arbiter.yaml");

        assertEquals("transfer-arbiter", config.name());
        assertEquals(SchedulerConfig.defaults(), config.scheduler());
        assertEquals(SystemResources.defaults(), config.systemResources());
        assertEquals(AllocationStrategy.defaults(), config.allocationStrategy());
    }

    @Test
    @DisplayName("Should load overrides and keep defaults for omitted keys")
    void shouldLoadOverrides() {
        ArbiterConfig config = ConfigLoader.load("classpath:arbiter-test.yaml");

        assertEquals("test-arbiter", config.name());
        assertEquals(new SchedulerConfig(50, 2000, false, 2, SchedulingPolicy.ADAPTIVE, 10, 5000,
                UnsatisfiableTaskPolicy.REJECT), config.scheduler());
        assertEquals(new SystemResources(100, 10240, 50, 100, 1024), config.systemResources());
        assertEquals(new TierQuota(8, 4, 10, 8, 8), config.allocationStrategy().quota(Tier.LOW));
        assertEquals(AllocationStrategy.defaults().quota(Tier.CRITICAL), config.allocationStrategy().quota(Tier.CRITICAL));
    }

    @Test
    @DisplayName("Should accept a configuration without the arbiter wrapper")
    void shouldLoadFlatConfiguration() {
        ArbiterConfig config = ConfigLoader.load("classpath:arbiter-flat.yaml");

        assertEquals("flat-arbiter", config.name());
        assertEquals(SchedulingPolicy.ROUND_ROBIN, config.scheduler().policy());
        assertEquals(SystemResources.defaults(), config.systemResources());
    }

    @Test
    @DisplayName("Should reject a misspelt key")
    void shouldRejectUnknownKey() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:arbiter-unknown-key.yaml"));

        assertTrue(e.getMessage().contains("preemtion-enabled"));
        assertTrue(e.getMessage().contains("scheduler"));
    }

    @Test
    @DisplayName("Should reject an unknown tier")
    void shouldRejectUnknownTier() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:arbiter-bad-tier.yaml"));

        assertTrue(e.getMessage().contains("urgent"));
    }

    @Test
    @DisplayName("Should reject a percentage above 100")
    void shouldRejectPercentOutOfRange() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:arbiter-bad-percent.yaml"));

        assertTrue(e.getMessage().contains("HIGH"));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    @DisplayName("Should fail when the file does not exist")
    void shouldFailOnMissingFile() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:does-not-exist.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("/no/such/arbiter.yaml"));
    }

    @Test
    @DisplayName("Should reject empty, scalar and malformed documents")
    void shouldRejectMalformedDocuments() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("just a string")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("scheduler: 5")));
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("scheduler:\n  tick-interval-ms: soon\n")));
    }

    @Test
    @DisplayName("Should reject values the records refuse")
    void shouldRejectInvalidValues() {
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("scheduler:\n  tick-interval-ms: 0\n")));
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("scheduler:\n  policy: lottery\n")));
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("system-resources:\n  max-concurrency: -1\n")));
    }

    @Test
    @DisplayName("Should reject numbers that do not fit their key instead of wrapping them")
    void shouldRejectOutOfRangeNumbers() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("system-resources:\n  max-memory-mb: 5000000000\n")));
        assertTrue(e.getMessage().contains("max-memory-mb"), e.getMessage());

        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("scheduler:\n  starvation-threshold-ms: 99999999999999999999\n")));
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("scheduler:\n  tick-interval-ms: 1.5\n")));
    }
}
