package net.homeroute.domain.routing;

import java.util.List;

/**
 * Everything pushed to the proxy in one load call.
 */
public record CompiledProxyConfig(List<CompiledRoute> routes, TlsPolicy tls) {

    public CompiledProxyConfig {
        routes = List.copyOf(routes);
    }

    public List<String> routeIds() {
        return routes.stream().map(CompiledRoute::id).toList();
    }
}
