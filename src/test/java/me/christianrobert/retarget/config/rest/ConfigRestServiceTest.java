package me.christianrobert.retarget.config.rest;

import jakarta.ws.rs.core.Response;
import me.christianrobert.retarget.config.service.ConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigRestServiceTest {

    private ConfigRestService restService;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        restService = new ConfigRestService();
        restService.configService = configService;
    }

    @Test
    void returnsAllConfiguration() {
        Response response = restService.getConfiguration();

        assertEquals(200, response.getStatus());
        Map<?, ?> entity = (Map<?, ?>) response.getEntity();
        assertEquals("retarget", entity.get(ConfigService.HEADER_TOOL_NAME));
    }

    @Test
    void emptySaveIsRejected() {
        assertEquals(400, restService.saveConfiguration(Map.of()).getStatus());
        assertEquals(400, restService.saveConfiguration(null).getStatus());
    }

    @Test
    void saveUpdatesConfiguration() {
        Response response = restService.saveConfiguration(Map.of(ConfigService.HEADER_TOOL_NAME, "py2x"));

        assertEquals(200, response.getStatus());
        assertEquals("py2x", configService.getConfigValueAsString(ConfigService.HEADER_TOOL_NAME));
    }

    @Test
    void getsSingleValue() {
        Response response = restService.getConfigValue(ConfigService.WRAPPER_PROGRAM_NAME);

        assertEquals(200, response.getStatus());
        Map<?, ?> entity = (Map<?, ?>) response.getEntity();
        assertEquals(ConfigService.WRAPPER_PROGRAM_NAME, entity.get("key"));
        assertEquals("Main", entity.get("value"));
    }

    @Test
    void unknownKeyIsNotFound() {
        assertEquals(404, restService.getConfigValue("no.such.key").getStatus());
        assertEquals(404, restService.setConfigValue("no.such.key", Map.of("value", 1)).getStatus());
    }

    @Test
    void setRequiresValue() {
        Response response = restService.setConfigValue(ConfigService.HEADER_ENABLED, Map.of("other", 1));

        assertEquals(400, response.getStatus());
        assertTrue(configService.isEnabled(ConfigService.HEADER_ENABLED, false));
    }

    @Test
    void setAndReset() {
        // Given
        Response set = restService.setConfigValue(ConfigService.HEADER_ENABLED, Map.of("value", false));
        assertEquals(200, set.getStatus());
        assertFalse(configService.isEnabled(ConfigService.HEADER_ENABLED, true));

        // When
        Response reset = restService.resetConfiguration();

        // Then
        assertEquals(200, reset.getStatus());
        assertTrue(configService.isEnabled(ConfigService.HEADER_ENABLED, false));
    }
}
