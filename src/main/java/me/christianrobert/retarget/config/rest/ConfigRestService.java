package me.christianrobert.retarget.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.retarget.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * REST access to the translation settings.
 *
 * <pre>
 * curl http://localhost:8080/api/config
 * curl -X PUT http://localhost:8080/api/config/translation.header.enabled \
 *   -H "Content-Type: application/json" --data '{"value": false}'
 * curl -X POST http://localhost:8080/api/config/reset
 * </pre>
 */
@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.info("Getting configuration");

        Map<String, Object> config = configService.getAllConfiguration();
        return Response.ok(config).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("status", "error", "message", "Configuration body cannot be empty"))
                    .build();
        }
        log.info("Saving configuration with {} entries", config.size());

        try {
            configService.updateConfiguration(config);

            Map<String, String> response = new HashMap<>();
            response.put("status", "success");
            response.put("message", "Configuration saved successfully");

            return Response.ok(response).build();
        } catch (Exception e) {
            log.error("Error saving configuration", e);

            Map<String, String> errorResponse = new HashMap<>();
            errorResponse.put("status", "error");
            errorResponse.put("message", "Failed to save configuration: " + e.getMessage());

            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(errorResponse)
                    .build();
        }
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        log.debug("Getting config value for key: {}", key);

        Object value = configService.getConfigValue(key);
        if (value == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Configuration key not found: " + key))
                    .build();
        }

        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    /**
     * Updates one known setting. Unknown keys are rejected so typos do not silently
     * create unused entries.
     */
    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        log.debug("Setting config value for key: {}", key);

        if (!configService.hasConfigKey(key)) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Configuration key not found: " + key))
                    .build();
        }
        if (body == null || !body.containsKey("value") || body.get("value") == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Request body must contain a non-null 'value' field"))
                    .build();
        }

        Object value = body.get("value");
        configService.setConfigValue(key, value);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("key", key);
        response.put("value", value);

        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        log.info("Resetting configuration to defaults");

        configService.resetToDefaults();
        return Response.ok(Map.of("status", "success", "message", "Configuration reset to defaults")).build();
    }
}
