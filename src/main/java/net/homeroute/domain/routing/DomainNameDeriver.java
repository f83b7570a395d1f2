package net.homeroute.domain.routing;

import net.homeroute.domain.registry.Application;
import net.homeroute.domain.registry.ApiEndpoint;
import net.homeroute.domain.registry.EndpointSet;
import net.homeroute.domain.registry.Environment;
import net.homeroute.domain.registry.Host;
import net.homeroute.domain.registry.Registry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps hosts and application endpoints to their externally visible hostnames.
 *
 * <p>Naming rules:
 * <ul>
 *   <li>host: {@code customDomain}, else {@code <subdomain>.<base>}</li>
 *   <li>frontend: {@code <slug>.<prefix>.<base>}, or {@code <slug>.<base>} without prefix</li>
 *   <li>API: {@code <slug>[-<apiSlug>].<apiPrefix>.<base>}</li>
 * </ul>
 * While no base domain is configured, base-relative names are returned without the suffix.
 *
 * <p>Every domain claim goes through this class, which makes it the one place
 * that detects collisions between entities.
 */
public final class DomainNameDeriver {

    public static final String DASHBOARD_LABEL = "proxy";
    public static final String AUTH_PORTAL_LABEL = "auth";

    private DomainNameDeriver() {
    }

    public static String domainFor(Host host, String baseDomain) {
        if (host.hasCustomDomain()) {
            return host.customDomain();
        }
        return join(host.subdomain(), baseDomain);
    }

    public static String domainFor(Application application, EndpointKind kind, Environment environment, String baseDomain) {
        if (kind instanceof EndpointKind.Api api) {
            String label = api.hasSlug() ? application.slug() + "-" + api.slug() : application.slug();
            return join(label, environment.apiPrefix(), baseDomain);
        }
        return join(application.slug(), environment.prefix(), baseDomain);
    }

    public static String systemDomain(String label, String baseDomain) {
        return join(label, baseDomain);
    }

    /**
     * Lists every name claimed by applications (first) and hosts, enabled or not,
     * in registry order. Application endpoints whose environment no longer exists are skipped.
     */
    public static List<PublishedEndpoint> publish(Registry registry) {
        String base = registry.baseDomain();
        List<PublishedEndpoint> published = new ArrayList<>();

        for (Application app : registry.applications()) {
            for (Map.Entry<String, EndpointSet> entry : app.endpoints().entrySet()) {
                Optional<Environment> environment = registry.findEnvironment(entry.getKey());
                EndpointSet set = entry.getValue();
                if (environment.isEmpty() || set == null) {
                    continue;
                }
                Environment env = environment.get();
                String owner = "application '" + app.slug() + "' (" + env.id() + ")";
                if (set.frontend() != null) {
                    published.add(new PublishedEndpoint(
                        RouteIds.forApplication(app.id(), EndpointKind.FRONTEND, env.id()),
                        domainFor(app, EndpointKind.FRONTEND, env, base),
                        set.frontend(),
                        env,
                        owner,
                        app.enabled(),
                        true
                    ));
                }
                for (ApiEndpoint api : set.apis()) {
                    EndpointKind kind = EndpointKind.api(api.slug());
                    published.add(new PublishedEndpoint(
                        RouteIds.forApplication(app.id(), kind, env.id()),
                        domainFor(app, kind, env, base),
                        api.asEndpoint(),
                        env,
                        owner,
                        app.enabled(),
                        true
                    ));
                }
            }
        }

        for (Host host : registry.hosts()) {
            published.add(new PublishedEndpoint(
                RouteIds.forHost(host.id()),
                domainFor(host, base),
                host.asEndpoint(),
                null,
                "host '" + domainFor(host, base) + "'",
                host.enabled(),
                !host.hasCustomDomain()
            ));
        }
        return published;
    }

    /**
     * Finds the first domain or route id claimed twice, including the reserved
     * dashboard and auth portal names. Route ids join application id, API slug and
     * environment id with dashes, so distinct endpoints can still end up with the same id.
     *
     * @return a description of the collision, empty when every name is unique
     */
    public static Optional<String> findCollision(Registry registry) {
        String base = registry.baseDomain();
        Map<String, String> owners = new HashMap<>();
        owners.put(systemDomain(DASHBOARD_LABEL, base), "the dashboard");
        owners.put(systemDomain(AUTH_PORTAL_LABEL, base), "the authentication portal");
        Map<String, String> routeOwners = new HashMap<>();
        routeOwners.put(RouteIds.SYSTEM_DASHBOARD, "the dashboard");
        routeOwners.put(RouteIds.SYSTEM_AUTH, "the authentication portal");

        for (PublishedEndpoint endpoint : publish(registry)) {
            // a base-relative name and a fully qualified one can only collide once a base domain exists
            String key = registry.hasBaseDomain() || endpoint.requiresBaseDomain()
                ? endpoint.domain().toLowerCase(Locale.ROOT)
                : "fqdn:" + endpoint.domain().toLowerCase(Locale.ROOT);
            String previous = owners.putIfAbsent(key, endpoint.owner());
            if (previous != null) {
                return Optional.of("Domain " + endpoint.domain() + " is already used by " + previous);
            }
            String previousRoute = routeOwners.putIfAbsent(endpoint.routeId(), endpoint.owner());
            if (previousRoute != null) {
                return Optional.of("Route id " + endpoint.routeId() + " is already used by " + previousRoute);
            }
        }
        return Optional.empty();
    }

    private static String join(String... parts) {
        StringBuilder builder = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isEmpty()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append('.');
            }
            builder.append(part);
        }
        return builder.toString();
    }
}
