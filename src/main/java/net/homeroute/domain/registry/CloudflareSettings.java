package net.homeroute.domain.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Wildcard certificate provider settings. The API credential itself is not
 * stored in the registry; only whether the provider is enabled and the
 * wildcard patterns derived from the environments.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CloudflareSettings(
    boolean enabled,
    List<String> wildcardDomains
) {

    public static final CloudflareSettings DISABLED = new CloudflareSettings(false, List.of());

    public CloudflareSettings {
        wildcardDomains = wildcardDomains == null ? List.of() : List.copyOf(wildcardDomains);
    }
}
