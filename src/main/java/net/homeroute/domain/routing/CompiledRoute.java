package net.homeroute.domain.routing;

import net.homeroute.domain.routing.handler.ForwardAuthHandler;
import net.homeroute.domain.routing.handler.RemoteIpMatcher;
import net.homeroute.domain.routing.handler.ReverseProxyHandler;
import net.homeroute.domain.routing.handler.RouteHandler;
import net.homeroute.domain.routing.handler.SubrouteBranch;
import net.homeroute.domain.routing.handler.SubrouteHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One host-matched rule of the proxy configuration.
 *
 * @param id stable rule id, stored by the proxy as {@code @id}
 * @param host exact hostname the rule matches
 * @param handlers handler chain, outermost first
 * @param terminal whether evaluation stops once the host matches
 */
public record CompiledRoute(
    String id,
    String host,
    List<RouteHandler> handlers,
    boolean terminal
) {

    public CompiledRoute {
        handlers = List.copyOf(handlers);
    }

    /**
     * Every handler of the chain including those nested in subroutes, depth first.
     */
    public List<RouteHandler> allHandlers() {
        List<RouteHandler> collected = new ArrayList<>();
        collect(handlers, collected);
        return collected;
    }

    /**
     * Address of the upstream the rule finally proxies to.
     */
    public Optional<String> upstream() {
        return allHandlers().stream()
            .filter(ReverseProxyHandler.class::isInstance)
            .map(handler -> ((ReverseProxyHandler) handler).dial())
            .reduce((first, second) -> second);
    }

    public long countHandlers(Class<? extends RouteHandler> type) {
        return allHandlers().stream().filter(type::isInstance).count();
    }

    public boolean isAuthIntercepted() {
        return countHandlers(ForwardAuthHandler.class) > 0;
    }

    public boolean isIpRestricted() {
        return handlers.stream()
            .filter(SubrouteHandler.class::isInstance)
            .flatMap(handler -> ((SubrouteHandler) handler).branches().stream())
            .anyMatch(branch -> branch.matcher() instanceof RemoteIpMatcher);
    }

    private static void collect(List<RouteHandler> chain, List<RouteHandler> collected) {
        for (RouteHandler handler : chain) {
            collected.add(handler);
            if (handler instanceof SubrouteHandler subroute) {
                for (SubrouteBranch branch : subroute.branches()) {
                    collect(branch.handlers(), collected);
                }
            }
        }
    }
}
