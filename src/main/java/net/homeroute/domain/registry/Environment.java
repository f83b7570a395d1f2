package net.homeroute.domain.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Deployment environment (production, development, ...) that shapes the
 * hostnames of every application endpoint published in it.
 *
 * @param id stable identifier derived from the name
 * @param name display name
 * @param prefix label inserted before the base domain for frontends; empty for none
 * @param apiPrefix label(s) inserted before the base domain for APIs
 * @param isDefault whether this is the default environment
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Environment(
    String id,
    String name,
    String prefix,
    String apiPrefix,
    @JsonProperty("isDefault") boolean isDefault
) {

    public Environment {
        prefix = prefix == null ? "" : prefix;
        apiPrefix = apiPrefix == null ? "" : apiPrefix;
    }

    public boolean hasPrefix() {
        return !prefix.isEmpty();
    }

    /**
     * Development environments let websocket upgrades skip forward-auth so
     * live-reload tooling keeps working.
     */
    public boolean isDevelopment() {
        return id != null && id.toLowerCase(Locale.ROOT).contains("dev");
    }

    public Environment withDefault(boolean value) {
        return new Environment(id, name, prefix, apiPrefix, value);
    }
}
