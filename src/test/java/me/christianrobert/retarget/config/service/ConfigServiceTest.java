package me.christianrobert.retarget.config.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void startsWithDefaults() {
        assertTrue(configService.isEnabled(ConfigService.HEADER_ENABLED, false));
        assertTrue(configService.isEnabled(ConfigService.IMPORTS_ENABLED, false));
        assertTrue(configService.isEnabled(ConfigService.FALLBACK_VERBATIM, false));
        assertEquals("retarget", configService.getConfigValueAsString(ConfigService.HEADER_TOOL_NAME));
        assertEquals("Main", configService.getConfigValueAsString(ConfigService.WRAPPER_PROGRAM_NAME));
        assertEquals(4, configService.getConfigValueAsInt(ConfigService.BATCH_PARALLELISM, 1));
    }

    @Test
    void booleanAcceptsStrings() {
        configService.setConfigValue(ConfigService.HEADER_ENABLED, "false");

        assertFalse(configService.getConfigValueAsBoolean(ConfigService.HEADER_ENABLED));
        assertFalse(configService.isEnabled(ConfigService.HEADER_ENABLED, true));
    }

    @Test
    void missingFlagUsesDefault() {
        assertNull(configService.getConfigValueAsBoolean("no.such.key"));
        assertTrue(configService.isEnabled("no.such.key", true));
    }

    @Test
    void intAcceptsNumbersAndNumericStrings() {
        configService.setConfigValue(ConfigService.BATCH_PARALLELISM, 8L);
        assertEquals(8, configService.getConfigValueAsInt(ConfigService.BATCH_PARALLELISM, 1));

        configService.setConfigValue(ConfigService.BATCH_PARALLELISM, " 2 ");
        assertEquals(2, configService.getConfigValueAsInt(ConfigService.BATCH_PARALLELISM, 1));

        configService.setConfigValue(ConfigService.BATCH_PARALLELISM, "many");
        assertEquals(1, configService.getConfigValueAsInt(ConfigService.BATCH_PARALLELISM, 1));
    }

    @Test
    void allConfigurationIsACopy() {
        // Given
        Map<String, Object> snapshot = configService.getAllConfiguration();

        // When
        snapshot.put(ConfigService.HEADER_TOOL_NAME, "changed");

        // Then
        assertEquals("retarget", configService.getConfigValueAsString(ConfigService.HEADER_TOOL_NAME));
    }

    @Test
    void updateAndReset() {
        // Given
        configService.updateConfiguration(Map.of(
                ConfigService.HEADER_TOOL_NAME, "py2x",
                ConfigService.IMPORTS_ENABLED, false));
        assertEquals("py2x", configService.getConfigValueAsString(ConfigService.HEADER_TOOL_NAME));
        assertFalse(configService.isEnabled(ConfigService.IMPORTS_ENABLED, true));

        // When
        configService.resetToDefaults();

        // Then
        assertEquals("retarget", configService.getConfigValueAsString(ConfigService.HEADER_TOOL_NAME));
        assertTrue(configService.isEnabled(ConfigService.IMPORTS_ENABLED, false));
        assertTrue(configService.hasConfigKey(ConfigService.BATCH_PARALLELISM));
        assertFalse(configService.hasConfigKey("no.such.key"));
    }
}
