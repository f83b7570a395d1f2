package net.homeroute.domain.registry.migration;

import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Version 1 to 2: an endpoint set holding a single {@code api} object and no
 * {@code apis} list gets {@code apis = [api]} with an empty slug.
 */
@Component
public class SingleApiMigration implements RegistryMigration {

    @Override
    public int fromVersion() {
        return 1;
    }

    @Override
    public ObjectNode apply(ObjectNode document) {
        JsonNode applications = document.get("applications");
        if (applications == null || !applications.isArray()) {
            return document;
        }
        for (JsonNode app : applications) {
            JsonNode endpoints = app.get("endpoints");
            if (endpoints == null || !endpoints.isObject()) {
                continue;
            }
            for (Map.Entry<String, JsonNode> entry : endpoints.properties()) {
                if (entry.getValue() instanceof ObjectNode set) {
                    liftSingleApi(set);
                }
            }
        }
        return document;
    }

    private static void liftSingleApi(ObjectNode set) {
        JsonNode api = set.get("api");
        if (!FlatApplicationMigration.isPresent(api) || set.has("apis")) {
            return;
        }
        ObjectNode lifted = FlatApplicationMigration.target(set, api, FlatApplicationMigration.LEGACY_API_PORT);
        lifted.put("slug", "");
        set.putArray("apis").add(lifted);
        set.remove("api");
    }
}
