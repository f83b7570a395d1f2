package net.homeroute.domain.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Upstream target for a single externally visible route.
 *
 * @param targetHost upstream host name or IP address
 * @param targetPort upstream TCP port (1-65535)
 * @param localOnly whether callers outside the private network ranges are refused
 * @param requireAuth whether requests pass through forward-authentication first
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Endpoint(
    String targetHost,
    int targetPort,
    boolean localOnly,
    boolean requireAuth
) {
}
