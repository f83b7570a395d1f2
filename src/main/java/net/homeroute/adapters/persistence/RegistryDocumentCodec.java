package net.homeroute.adapters.persistence;

import net.homeroute.domain.registry.ApiEndpoint;
import net.homeroute.domain.registry.Application;
import net.homeroute.domain.registry.CloudflareSettings;
import net.homeroute.domain.registry.Endpoint;
import net.homeroute.domain.registry.EndpointSet;
import net.homeroute.domain.registry.Environment;
import net.homeroute.domain.registry.Host;
import net.homeroute.domain.registry.Registry;
import net.homeroute.domain.registry.RegistryDefaults;
import net.homeroute.domain.registry.migration.RegistryMigrator;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps between the persisted JSON tree and the typed {@link Registry}.
 *
 * <p>Fields are mapped by hand so that older documents with missing flags
 * still load with the historical defaults (hosts and applications enabled,
 * access flags off). Unknown top-level fields travel through
 * {@link Registry#extensions()} untouched.</p>
 */
@Component
public class RegistryDocumentCodec {

    /** Keys written by earlier releases that no longer mean anything. */
    public static final Set<String> DEPRECATED_KEYS = Set.of("wildcardCert", "sslMode");

    private static final Set<String> KNOWN_KEYS = Set.of(
        RegistryMigrator.VERSION_FIELD, "revision", "baseDomain", "environments",
        "applications", "hosts", "cloudflare"
    );

    private final ObjectMapper objectMapper;

    public RegistryDocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Removes deprecated keys and fills in missing top-level fields. Runs before migration.
     */
    public ObjectNode normalize(ObjectNode document) {
        DEPRECATED_KEYS.forEach(document::remove);
        if (!document.has("baseDomain") || document.get("baseDomain").isNull()) {
            document.put("baseDomain", "");
        }
        if (!isArray(document, "environments")) {
            ArrayNode environments = document.putArray("environments");
            RegistryDefaults.environments().forEach(env -> environments.add(writeEnvironment(env)));
        }
        if (!isArray(document, "applications")) {
            document.putArray("applications");
        }
        if (!isArray(document, "hosts")) {
            document.putArray("hosts");
        }
        return document;
    }

    /**
     * @param document a normalized document at the current schema version
     */
    public Registry toRegistry(ObjectNode document) {
        List<Environment> environments = new ArrayList<>();
        for (JsonNode node : document.path("environments")) {
            environments.add(readEnvironment(node));
        }
        List<Application> applications = new ArrayList<>();
        for (JsonNode node : document.path("applications")) {
            applications.add(readApplication(node));
        }
        List<Host> hosts = new ArrayList<>();
        for (JsonNode node : document.path("hosts")) {
            hosts.add(readHost(node));
        }

        Map<String, JsonNode> extensions = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : document.properties()) {
            if (!KNOWN_KEYS.contains(entry.getKey())) {
                extensions.put(entry.getKey(), entry.getValue().deepCopy());
            }
        }

        return new Registry(
            RegistryMigrator.versionOf(document),
            document.path("revision").asLong(0L),
            text(document, "baseDomain", ""),
            environments,
            applications,
            hosts,
            readCloudflare(document.get("cloudflare")),
            extensions
        );
    }

    public ObjectNode toDocument(Registry registry) {
        ObjectNode document = objectMapper.createObjectNode();
        document.put(RegistryMigrator.VERSION_FIELD, registry.schemaVersion());
        document.put("revision", registry.revision());
        document.put("baseDomain", registry.baseDomain());

        ArrayNode environments = document.putArray("environments");
        registry.environments().forEach(env -> environments.add(writeEnvironment(env)));

        ArrayNode applications = document.putArray("applications");
        registry.applications().forEach(app -> applications.add(writeApplication(app)));

        ArrayNode hosts = document.putArray("hosts");
        registry.hosts().forEach(host -> hosts.add(writeHost(host)));

        ObjectNode cloudflare = document.putObject("cloudflare");
        cloudflare.put("enabled", registry.cloudflare().enabled());
        ArrayNode wildcards = cloudflare.putArray("wildcardDomains");
        registry.cloudflare().wildcardDomains().forEach(wildcards::add);

        registry.extensions().forEach((key, value) -> document.set(key, value.deepCopy()));
        return document;
    }

    /**
     * Converts any model object to its JSON shape for API responses.
     */
    public JsonNode toTree(Object value) {
        if (value instanceof Environment env) {
            return writeEnvironment(env);
        }
        if (value instanceof Application app) {
            return writeApplication(app);
        }
        if (value instanceof Host host) {
            return writeHost(host);
        }
        return objectMapper.valueToTree(value);
    }

    private Environment readEnvironment(JsonNode node) {
        return new Environment(
            text(node, "id", ""),
            text(node, "name", ""),
            text(node, "prefix", ""),
            text(node, "apiPrefix", ""),
            node.path("isDefault").asBoolean(false)
        );
    }

    private ObjectNode writeEnvironment(Environment env) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", env.id());
        node.put("name", env.name());
        node.put("prefix", env.prefix());
        node.put("apiPrefix", env.apiPrefix());
        node.put("isDefault", env.isDefault());
        return node;
    }

    private Application readApplication(JsonNode node) {
        Map<String, EndpointSet> endpoints = new LinkedHashMap<>();
        JsonNode endpointsNode = node.path("endpoints");
        if (endpointsNode.isObject()) {
            for (Map.Entry<String, JsonNode> entry : endpointsNode.properties()) {
                JsonNode set = entry.getValue();
                if (set == null || !set.isObject()) {
                    continue;
                }
                List<ApiEndpoint> apis = new ArrayList<>();
                for (JsonNode api : set.path("apis")) {
                    apis.add(new ApiEndpoint(
                        text(api, "slug", ""),
                        text(api, "targetHost", null),
                        api.path("targetPort").asInt(0),
                        api.path("localOnly").asBoolean(false),
                        api.path("requireAuth").asBoolean(false)
                    ));
                }
                JsonNode frontend = set.get("frontend");
                endpoints.put(entry.getKey(), new EndpointSet(
                    frontend != null && frontend.isObject() ? readEndpoint(frontend) : null,
                    apis
                ));
            }
        }
        return new Application(
            text(node, "id", null),
            text(node, "name", ""),
            text(node, "slug", ""),
            node.path("enabled").asBoolean(true),
            endpoints,
            text(node, "createdAt", null)
        );
    }

    private ObjectNode writeApplication(Application app) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", app.id());
        node.put("name", app.name());
        node.put("slug", app.slug());
        node.put("enabled", app.enabled());
        ObjectNode endpoints = node.putObject("endpoints");
        for (Map.Entry<String, EndpointSet> entry : app.endpoints().entrySet()) {
            ObjectNode set = endpoints.putObject(entry.getKey());
            Endpoint frontend = entry.getValue().frontend();
            if (frontend == null) {
                set.putNull("frontend");
            } else {
                set.set("frontend", writeEndpoint(frontend));
            }
            ArrayNode apis = set.putArray("apis");
            for (ApiEndpoint api : entry.getValue().apis()) {
                ObjectNode apiNode = apis.addObject();
                apiNode.put("slug", api.slug());
                apiNode.put("targetHost", api.targetHost());
                apiNode.put("targetPort", api.targetPort());
                apiNode.put("localOnly", api.localOnly());
                apiNode.put("requireAuth", api.requireAuth());
            }
        }
        node.put("createdAt", app.createdAt());
        return node;
    }

    private Endpoint readEndpoint(JsonNode node) {
        return new Endpoint(
            text(node, "targetHost", null),
            node.path("targetPort").asInt(0),
            node.path("localOnly").asBoolean(false),
            node.path("requireAuth").asBoolean(false)
        );
    }

    private ObjectNode writeEndpoint(Endpoint endpoint) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("targetHost", endpoint.targetHost());
        node.put("targetPort", endpoint.targetPort());
        node.put("localOnly", endpoint.localOnly());
        node.put("requireAuth", endpoint.requireAuth());
        return node;
    }

    private Host readHost(JsonNode node) {
        return new Host(
            text(node, "id", null),
            emptyToNull(text(node, "subdomain", null)),
            emptyToNull(text(node, "customDomain", null)),
            text(node, "targetHost", null),
            node.path("targetPort").asInt(0),
            node.path("localOnly").asBoolean(false),
            node.path("requireAuth").asBoolean(false),
            node.path("enabled").asBoolean(true),
            text(node, "createdAt", null)
        );
    }

    private ObjectNode writeHost(Host host) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", host.id());
        node.put("subdomain", host.subdomain());
        node.put("customDomain", host.customDomain());
        node.put("targetHost", host.targetHost());
        node.put("targetPort", host.targetPort());
        node.put("localOnly", host.localOnly());
        node.put("requireAuth", host.requireAuth());
        node.put("enabled", host.enabled());
        node.put("createdAt", host.createdAt());
        return node;
    }

    private CloudflareSettings readCloudflare(JsonNode node) {
        if (node == null || !node.isObject()) {
            return CloudflareSettings.DISABLED;
        }
        List<String> wildcards = new ArrayList<>();
        for (JsonNode pattern : node.path("wildcardDomains")) {
            if (pattern.isString()) {
                wildcards.add(pattern.asString());
            }
        }
        return new CloudflareSettings(node.path("enabled").asBoolean(false), wildcards);
    }

    private static boolean isArray(ObjectNode document, String field) {
        JsonNode node = document.get(field);
        return node != null && node.isArray();
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        return value.isString() ? value.asString() : value.toString();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
