package net.homeroute.dto;

import java.util.List;

/**
 * Wildcard provider settings as shown on the dashboard. The token value never leaves the server.
 */
public record CloudflareView(boolean enabled, boolean hasToken, List<String> wildcardDomains) {
}
