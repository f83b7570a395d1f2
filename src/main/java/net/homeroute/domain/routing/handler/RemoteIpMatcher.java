package net.homeroute.domain.routing.handler;

import java.util.List;

/**
 * Matches callers whose address falls into one of the given CIDR ranges.
 */
public record RemoteIpMatcher(List<String> ranges) implements RequestMatcher {

    /** RFC 1918 networks plus loopback. */
    public static final List<String> PRIVATE_NETWORKS = List.of(
        "10.0.0.0/8",
        "172.16.0.0/12",
        "192.168.0.0/16",
        "127.0.0.0/8"
    );

    public RemoteIpMatcher {
        ranges = List.copyOf(ranges);
    }

    public static RemoteIpMatcher privateNetworks() {
        return new RemoteIpMatcher(PRIVATE_NETWORKS);
    }
}
