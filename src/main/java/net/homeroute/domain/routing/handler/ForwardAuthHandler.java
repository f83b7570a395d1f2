package net.homeroute.domain.routing.handler;

import java.util.List;

/**
 * Asks the authentication service whether the request may pass.
 *
 * <p>The original method is preserved and the original URI travels in
 * {@code X-Forwarded-Uri}. A {@code 2xx} answer copies {@code copyHeaders}
 * onto the request and lets the chain continue; {@code 401} and {@code 403}
 * become a {@code 302} to the URL the service returns in {@code redirectHeader}.
 *
 * @param dial authentication service address as {@code host:port}
 * @param uri path of the forward-auth endpoint
 * @param copyHeaders identity headers copied from the auth response
 * @param redirectHeader auth response header carrying the login URL
 */
public record ForwardAuthHandler(
    String dial,
    String uri,
    List<String> copyHeaders,
    String redirectHeader
) implements RouteHandler {

    public static final List<String> IDENTITY_HEADERS = List.of(
        "Remote-User",
        "Remote-Email",
        "Remote-Name",
        "Remote-Groups"
    );
    public static final String LOGIN_REDIRECT_HEADER = "X-Auth-Redirect";

    public ForwardAuthHandler {
        copyHeaders = List.copyOf(copyHeaders);
    }

    public static ForwardAuthHandler to(String host, int port, String uri) {
        return new ForwardAuthHandler(host + ":" + port, uri, IDENTITY_HEADERS, LOGIN_REDIRECT_HEADER);
    }
}
