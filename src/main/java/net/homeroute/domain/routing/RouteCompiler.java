package net.homeroute.domain.routing;

import net.homeroute.domain.registry.Endpoint;
import net.homeroute.domain.registry.Registry;
import net.homeroute.domain.routing.handler.ForwardAuthHandler;
import net.homeroute.domain.routing.handler.HeaderMatcher;
import net.homeroute.domain.routing.handler.RemoteIpMatcher;
import net.homeroute.domain.routing.handler.ReverseProxyHandler;
import net.homeroute.domain.routing.handler.RouteHandler;
import net.homeroute.domain.routing.handler.SecurityHeadersHandler;
import net.homeroute.domain.routing.handler.StaticResponseHandler;
import net.homeroute.domain.routing.handler.SubrouteBranch;
import net.homeroute.domain.routing.handler.SubrouteHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a registry into the ordered rule list for the edge proxy.
 *
 * <p>Order: the dashboard and auth portal system routes (once a base domain
 * exists), then enabled applications, then enabled hosts. Every rule is
 * terminal, so system routes must come first.
 *
 * <p>Chain of each rule: security headers, then an optional private-network
 * guard, then an optional forward-auth subroute, then the upstream proxy.
 */
public final class RouteCompiler {

    static final String LOCALHOST = "localhost";

    private final int dashboardPort;
    private final String forwardAuthPath;

    public RouteCompiler(int dashboardPort, String forwardAuthPath) {
        this.dashboardPort = dashboardPort;
        this.forwardAuthPath = forwardAuthPath;
    }

    public List<CompiledRoute> compile(Registry registry) {
        String base = registry.baseDomain();
        List<CompiledRoute> routes = new ArrayList<>();

        if (registry.hasBaseDomain()) {
            Endpoint dashboard = new Endpoint(LOCALHOST, dashboardPort, false, false);
            routes.add(rule(RouteIds.SYSTEM_DASHBOARD,
                DomainNameDeriver.systemDomain(DomainNameDeriver.DASHBOARD_LABEL, base), dashboard, false, base));
            routes.add(rule(RouteIds.SYSTEM_AUTH,
                DomainNameDeriver.systemDomain(DomainNameDeriver.AUTH_PORTAL_LABEL, base), dashboard, false, base));
        }

        for (PublishedEndpoint published : DomainNameDeriver.publish(registry)) {
            if (!published.enabled()) {
                continue;
            }
            if (published.requiresBaseDomain() && !registry.hasBaseDomain()) {
                continue;
            }
            routes.add(rule(published.routeId(), published.domain(), published.endpoint(),
                published.allowsWebsocketBypass(), base));
        }
        return List.copyOf(routes);
    }

    private CompiledRoute rule(String id, String host, Endpoint endpoint, boolean websocketBypass, String base) {
        List<RouteHandler> chain = new ArrayList<>();
        chain.add(SecurityHeadersHandler.forBaseDomain(base));

        List<RouteHandler> access = accessChain(endpoint, websocketBypass);
        if (endpoint.localOnly()) {
            chain.add(SubrouteHandler.of(
                SubrouteBranch.when(RemoteIpMatcher.privateNetworks(), access),
                SubrouteBranch.otherwise(List.of(StaticResponseHandler.forbidden()))
            ));
        } else {
            chain.addAll(access);
        }
        return new CompiledRoute(id, host, chain, true);
    }

    private List<RouteHandler> accessChain(Endpoint endpoint, boolean websocketBypass) {
        ReverseProxyHandler upstream = ReverseProxyHandler.to(endpoint.targetHost(), endpoint.targetPort());
        if (!endpoint.requireAuth()) {
            return List.of(upstream);
        }

        List<SubrouteBranch> branches = new ArrayList<>();
        if (websocketBypass) {
            // live-reload sockets of dev servers cannot follow a login redirect
            branches.add(SubrouteBranch.when(HeaderMatcher.websocketUpgrade(), List.of(upstream)));
        }
        branches.add(SubrouteBranch.otherwise(List.of(
            ForwardAuthHandler.to(LOCALHOST, dashboardPort, forwardAuthPath),
            upstream
        )));
        return List.of(new SubrouteHandler(branches));
    }
}
