package net.homeroute.support.proxy;

import net.homeroute.domain.routing.CompiledProxyConfig;
import net.homeroute.domain.routing.CompiledRoute;
import net.homeroute.domain.routing.TlsPolicy;
import net.homeroute.domain.routing.handler.ForwardAuthHandler;
import net.homeroute.domain.routing.handler.HeaderMatcher;
import net.homeroute.domain.routing.handler.RemoteIpMatcher;
import net.homeroute.domain.routing.handler.RequestMatcher;
import net.homeroute.domain.routing.handler.ReverseProxyHandler;
import net.homeroute.domain.routing.handler.RouteHandler;
import net.homeroute.domain.routing.handler.SecurityHeadersHandler;
import net.homeroute.domain.routing.handler.StaticResponseHandler;
import net.homeroute.domain.routing.handler.SubrouteBranch;
import net.homeroute.domain.routing.handler.SubrouteHandler;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Renders a compiled configuration as the JSON document accepted by the
 * proxy's {@code /load} admin endpoint.
 */
@Component
public class CaddyConfigRenderer {

    public static final String SERVER_NAME = "srv0";
    public static final String HTTPS_LISTEN = ":443";
    static final String CLOUDFLARE_TOKEN_PLACEHOLDER = "{env.CF_API_TOKEN}";
    private static final String AUTH_RESPONSE_HEADER = "{http.reverse_proxy.header.%s}";

    private final ObjectMapper objectMapper;

    public CaddyConfigRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param config compiled routes and TLS policy
     * @param adminListen address the admin API keeps listening on, so a push never locks the dashboard out
     * @return the full proxy document
     */
    public ObjectNode render(CompiledProxyConfig config, String adminListen) {
        ObjectNode root = objectMapper.createObjectNode();
        root.putObject("admin").put("listen", adminListen);

        ObjectNode apps = root.putObject("apps");
        ObjectNode server = apps.putObject("http").putObject("servers").putObject(SERVER_NAME);
        server.putArray("listen").add(HTTPS_LISTEN);
        ArrayNode routes = server.putArray("routes");
        for (CompiledRoute route : config.routes()) {
            routes.add(renderRoute(route));
        }

        if (!config.tls().subjects().isEmpty()) {
            apps.putObject("tls").putObject("automation").putArray("policies").add(renderPolicy(config.tls()));
        }
        return root;
    }

    private ObjectNode renderRoute(CompiledRoute route) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("@id", route.id());
        node.putArray("match").addObject().putArray("host").add(route.host());
        renderChain(route.handlers(), node.putArray("handle"));
        node.put("terminal", route.terminal());
        return node;
    }

    private void renderChain(List<RouteHandler> handlers, ArrayNode target) {
        for (RouteHandler handler : handlers) {
            target.add(renderHandler(handler));
        }
    }

    private ObjectNode renderHandler(RouteHandler handler) {
        ObjectNode node = objectMapper.createObjectNode();
        if (handler instanceof SecurityHeadersHandler headers) {
            node.put("handler", "headers");
            node.putObject("response").putObject("set")
                .putArray("Content-Security-Policy").add(headers.contentSecurityPolicy());
        } else if (handler instanceof SubrouteHandler subroute) {
            node.put("handler", "subroute");
            ArrayNode routes = node.putArray("routes");
            for (SubrouteBranch branch : subroute.branches()) {
                routes.add(renderBranch(branch));
            }
        } else if (handler instanceof ReverseProxyHandler proxy) {
            node.put("handler", "reverse_proxy");
            node.putArray("upstreams").addObject().put("dial", proxy.dial());
        } else if (handler instanceof ForwardAuthHandler auth) {
            renderForwardAuth(auth, node);
        } else if (handler instanceof StaticResponseHandler response) {
            node.put("handler", "static_response");
            node.put("status_code", response.statusCode());
            if (!response.headers().isEmpty()) {
                ObjectNode headers = node.putObject("headers");
                for (Map.Entry<String, String> header : response.headers().entrySet()) {
                    headers.putArray(header.getKey()).add(header.getValue());
                }
            }
        } else {
            throw new IllegalArgumentException("Unsupported handler: " + handler.getClass().getSimpleName());
        }
        return node;
    }

    private ObjectNode renderBranch(SubrouteBranch branch) {
        ObjectNode node = objectMapper.createObjectNode();
        if (branch.matcher() != null) {
            node.putArray("match").add(renderMatcher(branch.matcher()));
        }
        renderChain(branch.handlers(), node.putArray("handle"));
        node.put("terminal", branch.terminal());
        return node;
    }

    private ObjectNode renderMatcher(RequestMatcher matcher) {
        ObjectNode node = objectMapper.createObjectNode();
        if (matcher instanceof RemoteIpMatcher remoteIp) {
            ArrayNode ranges = node.putObject("remote_ip").putArray("ranges");
            remoteIp.ranges().forEach(ranges::add);
        } else if (matcher instanceof HeaderMatcher header) {
            ArrayNode values = node.putObject("header").putArray(header.name());
            header.values().forEach(values::add);
        } else {
            throw new IllegalArgumentException("Unsupported matcher: " + matcher.getClass().getSimpleName());
        }
        return node;
    }

    /**
     * Forward-auth is a reverse proxy to the auth service whose response is
     * handled instead of returned: 2xx copies identity headers and falls through
     * to the next handler, 401/403 redirect to the login page.
     */
    private void renderForwardAuth(ForwardAuthHandler auth, ObjectNode node) {
        node.put("handler", "reverse_proxy");
        node.putArray("upstreams").addObject().put("dial", auth.dial());
        // the auth check is a bodyless GET; the original method travels in X-Forwarded-Method
        ObjectNode rewrite = node.putObject("rewrite");
        rewrite.put("method", "GET");
        rewrite.put("uri", auth.uri());

        ObjectNode forwarded = node.putObject("headers").putObject("request").putObject("set");
        forwarded.putArray("X-Forwarded-Method").add("{http.request.method}");
        forwarded.putArray("X-Forwarded-Uri").add("{http.request.uri}");

        ArrayNode handleResponse = node.putArray("handle_response");

        ObjectNode allowed = handleResponse.addObject();
        allowed.putObject("match").putArray("status_code").add(2);
        ObjectNode copy = allowed.putArray("routes").addObject().putArray("handle").addObject();
        copy.put("handler", "headers");
        ObjectNode copied = copy.putObject("request").putObject("set");
        for (String header : auth.copyHeaders()) {
            copied.putArray(header).add(String.format(AUTH_RESPONSE_HEADER, header));
        }

        ObjectNode denied = handleResponse.addObject();
        denied.putObject("match").putArray("status_code").add(401).add(403);
        ObjectNode redirect = denied.putArray("routes").addObject().putArray("handle").addObject();
        redirect.put("handler", "static_response");
        redirect.put("status_code", 302);
        redirect.putObject("headers").putArray("Location")
            .add(String.format(AUTH_RESPONSE_HEADER, auth.redirectHeader()));
    }

    private ObjectNode renderPolicy(TlsPolicy policy) {
        ObjectNode node = objectMapper.createObjectNode();
        ArrayNode subjects = node.putArray("subjects");
        policy.subjects().forEach(subjects::add);

        ObjectNode issuer = node.putArray("issuers").addObject();
        issuer.put("module", "acme");
        if (policy.isWildcard()) {
            ObjectNode provider = issuer.putObject("challenges").putObject("dns").putObject("provider");
            provider.put("name", "cloudflare");
            provider.put("api_token", CLOUDFLARE_TOKEN_PLACEHOLDER);
        }
        return node;
    }
}
