package net.homeroute.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Host fields accepted on create and update. {@code null} means "not provided";
 * on update only target and flags can change.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HostDraft(
    String subdomain,
    String customDomain,
    String targetHost,
    Integer targetPort,
    Boolean localOnly,
    Boolean requireAuth,
    Boolean enabled
) {
}
