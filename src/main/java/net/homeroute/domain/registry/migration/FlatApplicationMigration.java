package net.homeroute.domain.registry.migration;

import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Version 0 to 1: applications stored a single {@code frontend} and {@code api}
 * target plus an {@code environments} id list. They become an
 * {@code endpoints} map with one entry per listed environment.
 */
@Component
public class FlatApplicationMigration implements RegistryMigration {

    static final String LEGACY_TARGET_HOST = "localhost";
    static final int LEGACY_FRONTEND_PORT = 3000;
    static final int LEGACY_API_PORT = 3001;
    private static final String DEFAULT_ENVIRONMENT = "prod";

    @Override
    public int fromVersion() {
        return 0;
    }

    @Override
    public ObjectNode apply(ObjectNode document) {
        JsonNode applications = document.get("applications");
        if (applications == null || !applications.isArray()) {
            return document;
        }
        for (JsonNode app : applications) {
            if (app instanceof ObjectNode appNode && !hasEndpointsObject(appNode)) {
                flatten(appNode);
            }
        }
        return document;
    }

    private static boolean hasEndpointsObject(ObjectNode app) {
        JsonNode endpoints = app.get("endpoints");
        return endpoints != null && endpoints.isObject();
    }

    private static void flatten(ObjectNode app) {
        JsonNode frontend = app.get("frontend");
        JsonNode api = app.get("api");

        ObjectNode endpoints = app.objectNode();
        for (String envId : environmentIds(app.get("environments"))) {
            ObjectNode set = endpoints.putObject(envId);
            if (isPresent(frontend)) {
                set.set("frontend", target(app, frontend, LEGACY_FRONTEND_PORT));
            } else {
                set.putNull("frontend");
            }
            ArrayNode apis = set.putArray("apis");
            if (isPresent(api)) {
                ObjectNode apiNode = target(app, api, LEGACY_API_PORT);
                apiNode.put("slug", "");
                apis.add(apiNode);
            }
        }

        app.remove("frontend");
        app.remove("api");
        app.remove("environments");
        app.set("endpoints", endpoints);

        JsonNode enabled = app.get("enabled");
        app.put("enabled", enabled == null || !enabled.isBoolean() || enabled.booleanValue());
    }

    private static List<String> environmentIds(JsonNode node) {
        List<String> ids = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode id : node) {
                if (id.isString() && !id.asString().isEmpty()) {
                    ids.add(id.asString());
                }
            }
        } else {
            ids.add(DEFAULT_ENVIRONMENT);
        }
        return ids;
    }

    static ObjectNode target(ObjectNode factory, JsonNode legacy, int defaultPort) {
        ObjectNode target = factory.objectNode();
        JsonNode host = legacy.get("targetHost");
        target.put("targetHost", host != null && host.isString() && !host.asString().isEmpty()
            ? host.asString()
            : LEGACY_TARGET_HOST);
        JsonNode port = legacy.get("targetPort");
        int value = port == null ? 0 : port.asInt(0);
        target.put("targetPort", value == 0 ? defaultPort : value);
        target.put("localOnly", isTrue(legacy.get("localOnly")));
        target.put("requireAuth", isTrue(legacy.get("requireAuth")));
        return target;
    }

    static boolean isPresent(JsonNode node) {
        return node != null && node.isObject();
    }

    static boolean isTrue(JsonNode node) {
        return node != null && node.asBoolean(false);
    }
}
