package net.homeroute.domain.routing.handler;

import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Branch of a {@link SubrouteHandler}; a {@code null} matcher matches every request.
 */
public record SubrouteBranch(
    @Nullable RequestMatcher matcher,
    List<RouteHandler> handlers,
    boolean terminal
) {

    public SubrouteBranch {
        handlers = List.copyOf(handlers);
    }

    public static SubrouteBranch when(RequestMatcher matcher, List<RouteHandler> handlers) {
        return new SubrouteBranch(matcher, handlers, true);
    }

    public static SubrouteBranch otherwise(List<RouteHandler> handlers) {
        return new SubrouteBranch(null, handlers, true);
    }
}
