package net.homeroute.domain.routing.handler;

/**
 * Proxies the request to a single upstream.
 *
 * @param dial upstream address as {@code host:port}
 */
public record ReverseProxyHandler(String dial) implements RouteHandler {

    public static ReverseProxyHandler to(String host, int port) {
        return new ReverseProxyHandler(host + ":" + port);
    }
}
