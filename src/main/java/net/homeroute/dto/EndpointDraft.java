package net.homeroute.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointDraft(
    String targetHost,
    Integer targetPort,
    Boolean localOnly,
    Boolean requireAuth
) {
}
