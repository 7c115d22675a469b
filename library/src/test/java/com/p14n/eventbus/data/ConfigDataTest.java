package com.p14n.eventbus.data;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDataTest {

    @Test
    void shouldUseDefaultsForMissingProperties() {
        ConfigData config = ConfigData.fromProperties(new Properties());

        assertEquals(1000, config.maxQueueSize());
        assertEquals(Duration.ofMillis(500), config.pollInterval());
        assertEquals(Duration.ofSeconds(5), config.shutdownTimeout());
        assertEquals(Duration.ofMillis(500), config.requestTimeout());
        assertEquals(ConfigData.defaults(), config);
    }

    @Test
    void shouldReadPrefixedProperties() {
        Properties props = new Properties();
        props.setProperty("eventbus.maxQueueSize", "10");
        props.setProperty("eventbus.pollIntervalMs", "100");
        props.setProperty("eventbus.requestTimeoutMs", " 2000 ");

        ConfigData config = ConfigData.fromProperties(props);

        assertEquals(10, config.maxQueueSize());
        assertEquals(Duration.ofMillis(100), config.pollInterval());
        assertEquals(Duration.ofSeconds(2), config.requestTimeout());
        assertEquals(Duration.ofSeconds(5), config.shutdownTimeout());
    }

    @Test
    void shouldRejectInvalidValues() {
        Properties props = new Properties();
        props.setProperty("eventbus.maxQueueSize", "many");
        assertThrows(IllegalArgumentException.class, () -> ConfigData.fromProperties(props));

        Properties tooLarge = new Properties();
        tooLarge.setProperty("eventbus.maxQueueSize", "4294967297");
        assertThrows(IllegalArgumentException.class, () -> ConfigData.fromProperties(tooLarge));

        assertThrows(IllegalArgumentException.class, () -> new ConfigData(0));
        assertThrows(IllegalArgumentException.class, () -> new ConfigData(10, Duration.ZERO));
    }
}
