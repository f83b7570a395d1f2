package net.homeroute.domain.routing.handler;

/**
 * One step of a compiled route's handler chain. The proxy runs the chain in
 * order until a handler writes the response.
 */
public sealed interface RouteHandler
    permits SecurityHeadersHandler, SubrouteHandler, ReverseProxyHandler, ForwardAuthHandler, StaticResponseHandler {
}
