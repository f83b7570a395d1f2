package net.homeroute.dto;

import jakarta.annotation.Nullable;

/**
 * Where the dashboard itself is published.
 *
 * @param configured whether a base domain exists and the system route is compiled
 * @param domain {@code proxy.<baseDomain>}, {@code null} until configured
 * @param port local dashboard port the route targets
 */
public record SystemRouteView(boolean configured, @Nullable String domain, int port) {
}
