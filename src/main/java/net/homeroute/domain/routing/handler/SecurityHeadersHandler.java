package net.homeroute.domain.routing.handler;

/**
 * Sets the Content-Security-Policy response header so pages behind the proxy
 * can only be framed by the dashboard and sibling subdomains.
 */
public record SecurityHeadersHandler(String contentSecurityPolicy) implements RouteHandler {

    public static SecurityHeadersHandler forBaseDomain(String baseDomain) {
        if (baseDomain == null || baseDomain.isEmpty()) {
            return new SecurityHeadersHandler("frame-ancestors 'self'");
        }
        return new SecurityHeadersHandler("frame-ancestors 'self' https://*." + baseDomain);
    }
}
