package net.homeroute.domain.registry;

import net.homeroute.domain.routing.DomainNameDeriver;
import net.homeroute.exception.RegistryValidationException;
import net.homeroute.util.HostnameRules;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Whole-registry invariants checked before every save. Field level checks on
 * incoming requests happen in the entity services; this is the last line that
 * keeps an inconsistent document from being persisted.
 */
public final class RegistryValidator {

    private RegistryValidator() {
    }

    /**
     * @throws RegistryValidationException describing the first violated invariant
     */
    public static void validate(Registry registry) {
        if (registry.hasBaseDomain() && !HostnameRules.isValidDomain(registry.baseDomain())) {
            throw new RegistryValidationException("Invalid domain format");
        }
        validateEnvironments(registry);
        validateApplications(registry);
        validateHosts(registry);
        DomainNameDeriver.findCollision(registry).ifPresent(message -> {
            throw new RegistryValidationException(message);
        });
    }

    private static void validateEnvironments(Registry registry) {
        Set<String> ids = new HashSet<>();
        int defaults = 0;
        for (Environment env : registry.environments()) {
            if (env.id() == null || env.id().isEmpty()) {
                throw new RegistryValidationException("Environment id is required");
            }
            if (!ids.add(env.id())) {
                throw new RegistryValidationException("Environment with this name already exists");
            }
            if (!HostnameRules.isValidPrefix(env.prefix(), true)) {
                throw new RegistryValidationException("Invalid prefix for environment " + env.id());
            }
            if (!HostnameRules.isValidPrefix(env.apiPrefix(), false)) {
                throw new RegistryValidationException("Invalid API prefix for environment " + env.id());
            }
            if (env.isDefault()) {
                defaults++;
            }
        }
        if (defaults > 1) {
            throw new RegistryValidationException("Only one environment can be the default");
        }
    }

    private static void validateApplications(Registry registry) {
        Set<String> slugs = new HashSet<>();
        for (Application app : registry.applications()) {
            if (!HostnameRules.isValidLabel(app.slug())) {
                throw new RegistryValidationException("Invalid slug format");
            }
            if (!slugs.add(app.slug())) {
                throw new RegistryValidationException("Application with this slug already exists");
            }
            for (Map.Entry<String, EndpointSet> entry : app.endpoints().entrySet()) {
                EndpointSet set = entry.getValue();
                if (set == null) {
                    continue;
                }
                if (set.frontend() != null) {
                    validateTarget(set.frontend().targetHost(), set.frontend().targetPort(),
                        "frontend", entry.getKey());
                }
                Set<String> apiSlugs = new HashSet<>();
                for (ApiEndpoint api : set.apis()) {
                    if (!apiSlugs.add(api.slug())) {
                        throw new RegistryValidationException("Duplicate API slug for environment " + entry.getKey());
                    }
                    validateTarget(api.targetHost(), api.targetPort(), "API", entry.getKey());
                }
            }
        }
    }

    private static void validateTarget(String targetHost, int targetPort, String kind, String environmentId) {
        if (targetHost == null || targetHost.isBlank()) {
            throw new RegistryValidationException("Missing " + kind + " target for environment " + environmentId);
        }
        if (!HostnameRules.isValidPort(targetPort)) {
            throw new RegistryValidationException("Invalid " + kind + " port for environment " + environmentId);
        }
    }

    private static void validateHosts(Registry registry) {
        Set<String> ids = new HashSet<>();
        for (Host host : registry.hosts()) {
            if (!ids.add(host.id())) {
                throw new RegistryValidationException("Duplicate host id " + host.id());
            }
            if (host.hasSubdomain() == host.hasCustomDomain()) {
                throw new RegistryValidationException("Exactly one of subdomain or custom domain is required");
            }
            if (host.hasSubdomain() && !HostnameRules.isValidLabel(host.subdomain())) {
                throw new RegistryValidationException("Invalid subdomain format");
            }
            if (host.hasCustomDomain() && !HostnameRules.isValidDomain(host.customDomain())) {
                throw new RegistryValidationException("Invalid custom domain format");
            }
            if (host.targetHost() == null || host.targetHost().isBlank()) {
                throw new RegistryValidationException("Target host and port are required");
            }
            if (!HostnameRules.isValidPort(host.targetPort())) {
                throw new RegistryValidationException("Invalid port number");
            }
        }
    }
}
