package net.homeroute.domain.routing;

/**
 * Compiled route identifiers. The proxy stores them as {@code @id} and the
 * certificate monitor keys its results by the same values.
 */
public final class RouteIds {

    public static final String SYSTEM_DASHBOARD = "system-dashboard";
    public static final String SYSTEM_AUTH = "system-auth";

    private RouteIds() {
    }

    public static String forApplication(String applicationId, EndpointKind kind, String environmentId) {
        return applicationId + "-" + kind.routeIdSegment() + "-" + environmentId;
    }

    public static String forHost(String hostId) {
        return hostId;
    }
}
