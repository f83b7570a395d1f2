package net.homeroute.domain.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.annotation.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Application published under {@code slug} in one or more environments.
 *
 * @param id stable identifier, also the prefix of every compiled route id
 * @param name display name
 * @param slug URL-safe label, unique across the registry
 * @param enabled disabled applications compile to no routes
 * @param endpoints endpoint sets keyed by environment id, in insertion order
 * @param createdAt ISO-8601 creation timestamp
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Application(
    String id,
    String name,
    String slug,
    boolean enabled,
    Map<String, EndpointSet> endpoints,
    @Nullable String createdAt
) {

    public Application {
        endpoints = endpoints == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(endpoints));
    }

    public boolean usesEnvironment(String environmentId) {
        return endpoints.containsKey(environmentId);
    }

    public Application withEnabled(boolean value) {
        return new Application(id, name, slug, value, endpoints, createdAt);
    }

    public Application withEndpoints(Map<String, EndpointSet> value) {
        return new Application(id, name, slug, enabled, value, createdAt);
    }

    public Application withIdentity(String newName, String newSlug) {
        return new Application(id, newName, newSlug, enabled, endpoints, createdAt);
    }
}
