package net.homeroute.domain.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Endpoints an application exposes in a single environment.
 *
 * @param frontend frontend target, or {@code null} when the application has no frontend there
 * @param apis ordered API targets
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointSet(
    @Nullable Endpoint frontend,
    List<ApiEndpoint> apis
) {

    public EndpointSet {
        apis = apis == null ? List.of() : List.copyOf(apis);
    }

    public boolean isEmpty() {
        return frontend == null && apis.isEmpty();
    }
}
