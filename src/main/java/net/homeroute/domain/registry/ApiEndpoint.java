package net.homeroute.domain.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * API endpoint of an application in one environment. The optional {@code slug}
 * disambiguates several APIs of the same application and environment; an empty
 * slug means the API is published under the bare application label.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiEndpoint(
    String slug,
    String targetHost,
    int targetPort,
    boolean localOnly,
    boolean requireAuth
) {

    public ApiEndpoint {
        slug = slug == null ? "" : slug;
    }

    public boolean hasSlug() {
        return !slug.isEmpty();
    }

    public Endpoint asEndpoint() {
        return new Endpoint(targetHost, targetPort, localOnly, requireAuth);
    }
}
