package net.homeroute.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiEndpointDraft(
    String slug,
    String targetHost,
    Integer targetPort,
    Boolean localOnly,
    Boolean requireAuth
) {
}
