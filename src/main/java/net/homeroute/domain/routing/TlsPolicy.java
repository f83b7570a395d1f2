package net.homeroute.domain.routing;

import java.util.List;

/**
 * Certificate automation policy pushed alongside the routes.
 *
 * @param strategy issuance strategy, never mixed within one push
 * @param subjects wildcard patterns or exact hostnames, in route order
 */
public record TlsPolicy(TlsStrategy strategy, List<String> subjects) {

    public TlsPolicy {
        subjects = List.copyOf(subjects);
    }

    public boolean isWildcard() {
        return strategy == TlsStrategy.WILDCARD_DNS;
    }
}
