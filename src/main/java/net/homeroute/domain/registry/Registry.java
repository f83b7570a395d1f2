package net.homeroute.domain.registry;

import tools.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * The whole reverse-proxy registry: base domain, environments, applications,
 * standalone hosts and TLS provider settings. Instances are immutable; every
 * change produces a new registry that is passed explicitly through the
 * validate, persist and compile pipeline.
 *
 * @param schemaVersion persisted document shape version
 * @param revision optimistic concurrency counter, incremented on every save
 * @param baseDomain lower-cased base domain, empty until configured
 * @param environments environments in display order
 * @param applications applications in creation order
 * @param hosts standalone hosts in creation order
 * @param cloudflare wildcard certificate provider settings
 * @param extensions unknown top-level document fields, preserved verbatim
 */
public record Registry(
    int schemaVersion,
    long revision,
    String baseDomain,
    List<Environment> environments,
    List<Application> applications,
    List<Host> hosts,
    CloudflareSettings cloudflare,
    Map<String, JsonNode> extensions
) {

    public Registry {
        baseDomain = baseDomain == null ? "" : baseDomain;
        environments = environments == null ? List.of() : List.copyOf(environments);
        applications = applications == null ? List.of() : List.copyOf(applications);
        hosts = hosts == null ? List.of() : List.copyOf(hosts);
        cloudflare = cloudflare == null ? CloudflareSettings.DISABLED : cloudflare;
        extensions = extensions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    public boolean hasBaseDomain() {
        return !baseDomain.isEmpty();
    }

    public Optional<Environment> findEnvironment(String id) {
        return environments.stream().filter(env -> id.equals(env.id())).findFirst();
    }

    public Optional<Application> findApplication(String id) {
        return applications.stream().filter(app -> id.equals(app.id())).findFirst();
    }

    public Optional<Host> findHost(String id) {
        return hosts.stream().filter(host -> id.equals(host.id())).findFirst();
    }

    public Registry withRevision(long value) {
        return new Registry(schemaVersion, value, baseDomain, environments, applications, hosts, cloudflare, extensions);
    }

    public Registry withBaseDomain(String value) {
        return new Registry(schemaVersion, revision, value, environments, applications, hosts, cloudflare, extensions);
    }

    public Registry withEnvironments(List<Environment> value) {
        return new Registry(schemaVersion, revision, baseDomain, value, applications, hosts, cloudflare, extensions);
    }

    public Registry withApplications(List<Application> value) {
        return new Registry(schemaVersion, revision, baseDomain, environments, value, hosts, cloudflare, extensions);
    }

    public Registry withHosts(List<Host> value) {
        return new Registry(schemaVersion, revision, baseDomain, environments, applications, value, cloudflare, extensions);
    }

    public Registry withCloudflare(CloudflareSettings value) {
        return new Registry(schemaVersion, revision, baseDomain, environments, applications, hosts, value, extensions);
    }

    public Registry replaceHost(String id, UnaryOperator<Host> change) {
        List<Host> updated = new ArrayList<>(hosts.size());
        for (Host host : hosts) {
            updated.add(id.equals(host.id()) ? change.apply(host) : host);
        }
        return withHosts(updated);
    }

    public Registry replaceApplication(String id, UnaryOperator<Application> change) {
        List<Application> updated = new ArrayList<>(applications.size());
        for (Application app : applications) {
            updated.add(id.equals(app.id()) ? change.apply(app) : app);
        }
        return withApplications(updated);
    }
}
