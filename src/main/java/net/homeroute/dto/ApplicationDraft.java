package net.homeroute.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Application fields accepted on create and update. On update a {@code null}
 * value in {@code endpoints} removes that environment from the application.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApplicationDraft(
    String name,
    String slug,
    Boolean enabled,
    Map<String, EndpointSetDraft> endpoints
) {
}
