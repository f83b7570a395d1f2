package net.homeroute.domain.routing;

import net.homeroute.domain.registry.Environment;
import net.homeroute.domain.registry.Registry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Chooses between wildcard DNS-challenge issuance and per-hostname issuance.
 */
public final class TlsPolicyBuilder {

    private TlsPolicyBuilder() {
    }

    /**
     * Wildcard issuance is used only when the provider is enabled, its API token
     * is configured and there is at least one wildcard pattern; every other case
     * falls back to exact hostnames taken from the compiled routes.
     */
    public static TlsPolicy build(Registry registry, List<CompiledRoute> routes, boolean credentialPresent) {
        List<String> wildcards = registry.cloudflare().wildcardDomains();
        if (registry.cloudflare().enabled() && credentialPresent && !wildcards.isEmpty()) {
            return new TlsPolicy(TlsStrategy.WILDCARD_DNS, wildcards);
        }

        Set<String> hosts = new LinkedHashSet<>();
        for (CompiledRoute route : routes) {
            hosts.add(route.host());
        }
        return new TlsPolicy(TlsStrategy.PER_HOST, new ArrayList<>(hosts));
    }

    /**
     * One frontend and one API pattern per environment, for example
     * {@code *.example.com}, {@code *.api.example.com}, {@code *.dev.example.com}.
     * Empty while no base domain is configured.
     */
    public static List<String> deriveWildcardDomains(Registry registry) {
        if (!registry.hasBaseDomain()) {
            return List.of();
        }
        String base = registry.baseDomain();
        Set<String> patterns = new LinkedHashSet<>();
        for (Environment env : registry.environments()) {
            patterns.add(env.hasPrefix() ? "*." + env.prefix() + "." + base : "*." + base);
            if (!env.apiPrefix().isEmpty()) {
                patterns.add("*." + env.apiPrefix() + "." + base);
            }
        }
        return new ArrayList<>(patterns);
    }
}
