package net.homeroute.domain.routing.handler;

import java.util.List;

/**
 * Evaluates its branches in order; the first terminal branch whose matcher
 * accepts the request ends evaluation.
 */
public record SubrouteHandler(List<SubrouteBranch> branches) implements RouteHandler {

    public SubrouteHandler {
        branches = List.copyOf(branches);
    }

    public static SubrouteHandler of(SubrouteBranch... branches) {
        return new SubrouteHandler(List.of(branches));
    }
}
