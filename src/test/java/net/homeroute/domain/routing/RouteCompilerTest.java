package net.homeroute.domain.routing;

import net.homeroute.adapters.persistence.RegistryDocumentCodec;
import net.homeroute.domain.registry.Application;
import net.homeroute.domain.registry.Host;
import net.homeroute.domain.registry.Registry;
import net.homeroute.domain.registry.migration.RegistryMigrator;
import net.homeroute.domain.routing.handler.ForwardAuthHandler;
import net.homeroute.domain.routing.handler.HeaderMatcher;
import net.homeroute.domain.routing.handler.RemoteIpMatcher;
import net.homeroute.domain.routing.handler.ReverseProxyHandler;
import net.homeroute.domain.routing.handler.SecurityHeadersHandler;
import net.homeroute.domain.routing.handler.StaticResponseHandler;
import net.homeroute.domain.routing.handler.SubrouteBranch;
import net.homeroute.domain.routing.handler.SubrouteHandler;
import net.homeroute.test.RegistryFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;

import static net.homeroute.test.RegistryFixtures.BASE_DOMAIN;
import static net.homeroute.test.RegistryFixtures.DEV;
import static net.homeroute.test.RegistryFixtures.api;
import static net.homeroute.test.RegistryFixtures.application;
import static net.homeroute.test.RegistryFixtures.customDomainHost;
import static net.homeroute.test.RegistryFixtures.endpoint;
import static net.homeroute.test.RegistryFixtures.endpoints;
import static net.homeroute.test.RegistryFixtures.registry;
import static net.homeroute.test.RegistryFixtures.subdomainHost;
import static net.homeroute.test.RegistryFixtures.wwwApplication;
import static org.assertj.core.api.Assertions.assertThat;

class RouteCompilerTest {

    private static final String FORWARD_AUTH_PATH = "/api/authz/forward-auth";

    private final RouteCompiler compiler = new RouteCompiler(4000, FORWARD_AUTH_PATH);

    @Test
    @DisplayName("Frontend proxies directly while the authenticated API is intercepted first")
    void compile_endToEndExample() {
        Registry registry = registry(BASE_DOMAIN, List.of(wwwApplication()), List.of());

        List<CompiledRoute> routes = compiler.compile(registry);

        assertThat(routes).extracting(CompiledRoute::host)
            .containsExactly("proxy.example.com", "auth.example.com", "www.example.com", "www.api.example.com");

        CompiledRoute frontend = routes.get(2);
        assertThat(frontend.id()).isEqualTo("app-www-frontend-prod");
        assertThat(frontend.upstream()).hasValue("10.0.0.5:3000");
        assertThat(frontend.isAuthIntercepted()).isFalse();
        assertThat(frontend.handlers()).containsExactly(
            new SecurityHeadersHandler("frame-ancestors 'self' https://*.example.com"),
            new ReverseProxyHandler("10.0.0.5:3000"));

        CompiledRoute api = routes.get(3);
        assertThat(api.id()).isEqualTo("app-www-api-prod");
        assertThat(api.upstream()).hasValue("10.0.0.5:3001");
        assertThat(api.isAuthIntercepted()).isTrue();
        ForwardAuthHandler auth = (ForwardAuthHandler) api.allHandlers().stream()
            .filter(ForwardAuthHandler.class::isInstance)
            .findFirst()
            .orElseThrow();
        assertThat(auth.dial()).isEqualTo("localhost:4000");
        assertThat(auth.uri()).isEqualTo(FORWARD_AUTH_PATH);
        assertThat(auth.copyHeaders()).containsExactlyElementsOf(ForwardAuthHandler.IDENTITY_HEADERS);
    }

    @Test
    void compile_placesSystemRoutesFirstAndWithoutAuth() {
        Host catchAll = subdomainHost("h1", "grafana", "10.0.0.9", 3000);
        Registry registry = registry(BASE_DOMAIN, List.of(), List.of(catchAll));

        List<CompiledRoute> routes = compiler.compile(registry);

        assertThat(routes.get(0).id()).isEqualTo(RouteIds.SYSTEM_DASHBOARD);
        assertThat(routes.get(1).id()).isEqualTo(RouteIds.SYSTEM_AUTH);
        assertThat(routes.subList(0, 2)).allSatisfy(route -> {
            assertThat(route.upstream()).hasValue("localhost:4000");
            assertThat(route.isAuthIntercepted()).isFalse();
            assertThat(route.terminal()).isTrue();
        });
    }

    @Test
    @DisplayName("Disabling an entity removes its rules and keeps the order of the rest")
    void compile_disabledEntitiesDisappearWithoutReordering() {
        Host first = subdomainHost("h1", "grafana", "10.0.0.9", 3000);
        Host second = subdomainHost("h2", "nas", "10.0.0.2", 5000);
        Host third = subdomainHost("h3", "media", "10.0.0.3", 8096);
        Registry registry = registry(BASE_DOMAIN, List.of(wwwApplication()), List.of(first, second, third));

        List<String> before = ids(compiler.compile(registry));
        List<String> after = ids(compiler.compile(registry.replaceHost("h2", host -> host.withFlags(false, false, false))));
        List<String> withoutApp = ids(compiler.compile(registry.replaceApplication("app-www", app -> app.withEnabled(false))));

        assertThat(after).isEqualTo(before.stream().filter(id -> !id.equals("h2")).toList());
        assertThat(withoutApp).isEqualTo(before.stream().filter(id -> !id.startsWith("app-www")).toList());
    }

    @Test
    void compile_everyAuthenticatedRouteHasExactlyOneForwardAuth() {
        Application dev = application("app-dev", "shop", DEV, endpoints(
            endpoint("10.0.0.7", 5173, false, true),
            api("", "10.0.0.7", 8000, true, true),
            api("admin", "10.0.0.7", 8001, false, true)));
        Host host = new Host("h1", "nas", null, "10.0.0.2", 5000, true, true, true, null);
        Registry registry = registry(BASE_DOMAIN, List.of(wwwApplication(), dev), List.of(host));

        List<CompiledRoute> authenticated = compiler.compile(registry).stream()
            .filter(CompiledRoute::isAuthIntercepted)
            .toList();

        assertThat(authenticated).extracting(CompiledRoute::id).containsExactly(
            "app-www-api-prod", "app-dev-frontend-dev", "app-dev-api-dev", "app-dev-api-admin-dev", "h1");
        assertThat(authenticated).allSatisfy(route ->
            assertThat(route.countHandlers(ForwardAuthHandler.class)).isEqualTo(1));
    }

    @Test
    void compile_developmentRoutesLetWebsocketUpgradesBypassAuth() {
        Application dev = application("app-dev", "shop", DEV, endpoints(endpoint("10.0.0.7", 5173, false, true)));
        Registry registry = registry(BASE_DOMAIN, List.of(dev), List.of());

        CompiledRoute route = compiler.compile(registry).get(2);

        assertThat(route.host()).isEqualTo("shop.dev.example.com");
        SubrouteHandler subroute = (SubrouteHandler) route.handlers().get(1);
        assertThat(subroute.branches()).hasSize(2);
        SubrouteBranch websocket = subroute.branches().get(0);
        assertThat(websocket.matcher()).isEqualTo(HeaderMatcher.websocketUpgrade());
        assertThat(websocket.handlers()).containsExactly(new ReverseProxyHandler("10.0.0.7:5173"));
        assertThat(subroute.branches().get(1).matcher()).isNull();
    }

    @Test
    void compile_localOnlyWrapsChainInPrivateNetworkGuard() {
        Host host = new Host("h1", "router", null, "192.168.1.1", 80, true, false, true, null);
        Registry registry = registry(BASE_DOMAIN, List.of(), List.of(host));

        CompiledRoute route = compiler.compile(registry).get(2);

        assertThat(route.isIpRestricted()).isTrue();
        SubrouteHandler guard = (SubrouteHandler) route.handlers().get(1);
        assertThat(guard.branches().get(0).matcher()).isEqualTo(RemoteIpMatcher.privateNetworks());
        assertThat(guard.branches().get(0).handlers()).containsExactly(new ReverseProxyHandler("192.168.1.1:80"));
        assertThat(guard.branches().get(1).handlers()).containsExactly(StaticResponseHandler.forbidden());
    }

    @Test
    void compile_withoutBaseDomainKeepsOnlyFullyQualifiedHosts() {
        Registry registry = registry("", List.of(wwwApplication()), List.of(
            subdomainHost("h1", "grafana", "10.0.0.9", 3000),
            customDomainHost("h2", "media.example.org", "10.0.0.3", 8096)));

        List<CompiledRoute> routes = compiler.compile(registry);

        assertThat(routes).extracting(CompiledRoute::id).containsExactly("h2");
        assertThat(routes.get(0).handlers().get(0))
            .isEqualTo(new SecurityHeadersHandler("frame-ancestors 'self'"));
    }

    @Test
    @DisplayName("A migrated legacy document compiles exactly like its native equivalent")
    void compile_migratedLegacyDocumentMatchesNative() {
        ObjectMapper mapper = RegistryFixtures.objectMapper();
        RegistryDocumentCodec codec = new RegistryDocumentCodec(mapper);
        RegistryMigrator migrator = RegistryFixtures.migrator();

        ObjectNode legacy = (ObjectNode) mapper.readTree("""
            {"baseDomain":"example.com","applications":[{"id":"a1","name":"Shop","slug":"shop",
              "frontend":{"targetHost":"10.0.0.5","targetPort":3000},
              "api":{"targetHost":"10.0.0.5","targetPort":3001,"requireAuth":true},
              "environments":["prod"]}]}
            """);
        ObjectNode current = (ObjectNode) mapper.readTree("""
            {"schemaVersion":2,"baseDomain":"example.com","applications":[{"id":"a1","name":"Shop","slug":"shop",
              "enabled":true,"endpoints":{"prod":{
                "frontend":{"targetHost":"10.0.0.5","targetPort":3000,"localOnly":false,"requireAuth":false},
                "apis":[{"slug":"","targetHost":"10.0.0.5","targetPort":3001,"localOnly":false,"requireAuth":true}]}}}]}
            """);

        Registry fromLegacy = codec.toRegistry(migrator.migrate(codec.normalize(legacy)));
        Registry fromCurrent = codec.toRegistry(migrator.migrate(codec.normalize(current)));

        assertThat(compiler.compile(fromLegacy)).isEqualTo(compiler.compile(fromCurrent));
    }

    private static List<String> ids(List<CompiledRoute> routes) {
        return routes.stream().map(CompiledRoute::id).toList();
    }
}
