package net.homeroute.domain.routing;

import jakarta.annotation.Nullable;
import net.homeroute.domain.registry.Endpoint;
import net.homeroute.domain.registry.Environment;

/**
 * One externally visible name claimed by a registry entity.
 *
 * @param routeId stable id shared by the compiled route and its certificate status
 * @param domain derived hostname, relative to the base domain while none is configured
 * @param endpoint upstream and access flags
 * @param environment owning environment for application endpoints, {@code null} otherwise
 * @param owner human readable owner used in collision messages
 * @param enabled whether the owning entity is enabled
 * @param requiresBaseDomain whether the name only exists once a base domain is set
 */
public record PublishedEndpoint(
    String routeId,
    String domain,
    Endpoint endpoint,
    @Nullable Environment environment,
    String owner,
    boolean enabled,
    boolean requiresBaseDomain
) {

    public boolean allowsWebsocketBypass() {
        return environment != null && environment.isDevelopment();
    }
}
