package net.homeroute.domain.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.annotation.Nullable;

/**
 * Standalone route that is not part of an application. Exactly one of
 * {@code subdomain} (composed with the base domain) or {@code customDomain}
 * (fully qualified) is set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Host(
    String id,
    @Nullable String subdomain,
    @Nullable String customDomain,
    String targetHost,
    int targetPort,
    boolean localOnly,
    boolean requireAuth,
    boolean enabled,
    @Nullable String createdAt
) {

    public boolean hasCustomDomain() {
        return customDomain != null && !customDomain.isEmpty();
    }

    public boolean hasSubdomain() {
        return subdomain != null && !subdomain.isEmpty();
    }

    public Endpoint asEndpoint() {
        return new Endpoint(targetHost, targetPort, localOnly, requireAuth);
    }

    public Host withTarget(String newTargetHost, int newTargetPort) {
        return new Host(id, subdomain, customDomain, newTargetHost, newTargetPort, localOnly, requireAuth, enabled, createdAt);
    }

    public Host withFlags(boolean newLocalOnly, boolean newRequireAuth, boolean newEnabled) {
        return new Host(id, subdomain, customDomain, targetHost, targetPort, newLocalOnly, newRequireAuth, newEnabled, createdAt);
    }
}
