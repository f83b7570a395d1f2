package net.homeroute.service;

import lombok.extern.slf4j.Slf4j;
import net.homeroute.domain.registry.Host;
import net.homeroute.domain.registry.Registry;
import net.homeroute.domain.registry.RegistryChange;
import net.homeroute.dto.HostDraft;
import net.homeroute.exception.RegistryValidationException;
import net.homeroute.util.HostnameRules;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * CRUD for standalone hosts, each expressed as one {@link RegistryStore#mutate} call.
 */
@Slf4j
@Service
public class HostService {

    private final RegistryStore registryStore;

    public HostService(RegistryStore registryStore) {
        this.registryStore = registryStore;
    }

    public List<Host> list() {
        return registryStore.load().hosts();
    }

    public MutationResult<Host> create(HostDraft draft) {
        if (!StringUtils.hasText(draft.targetHost()) || draft.targetPort() == null) {
            throw new RegistryValidationException("Target host and port are required");
        }
        String subdomain = HostnameRules.normalize(draft.subdomain());
        String customDomain = HostnameRules.normalize(draft.customDomain());
        boolean hasSubdomain = StringUtils.hasText(subdomain);
        boolean hasCustomDomain = StringUtils.hasText(customDomain);
        if (!hasSubdomain && !hasCustomDomain) {
            throw new RegistryValidationException("Subdomain or custom domain is required");
        }
        if (hasSubdomain && hasCustomDomain) {
            throw new RegistryValidationException("Provide either a subdomain or a custom domain, not both");
        }
        requireValidPort(draft.targetPort());
        if (hasSubdomain && !HostnameRules.isValidLabel(subdomain)) {
            throw new RegistryValidationException("Invalid subdomain format");
        }
        if (hasCustomDomain && !HostnameRules.isValidDomain(customDomain)) {
            throw new RegistryValidationException("Invalid custom domain format");
        }

        Host host = new Host(
            UUID.randomUUID().toString(),
            hasSubdomain ? subdomain : null,
            hasCustomDomain ? customDomain : null,
            draft.targetHost().trim(),
            draft.targetPort(),
            Boolean.TRUE.equals(draft.localOnly()),
            Boolean.TRUE.equals(draft.requireAuth()),
            true,
            Instant.now().toString()
        );
        MutationResult<Host> result = registryStore.mutate(registry -> {
            List<Host> hosts = new ArrayList<>(registry.hosts());
            hosts.add(host);
            return RegistryChange.of(registry.withHosts(hosts), host);
        });
        log.info("Added host {} -> {}:{}", hasSubdomain ? subdomain : customDomain, host.targetHost(), host.targetPort());
        return result;
    }

    /**
     * Updates target and flags; the published name of a host is fixed at creation.
     */
    public MutationResult<Host> update(String id, HostDraft draft) {
        if (draft.targetPort() != null) {
            requireValidPort(draft.targetPort());
        }
        if (draft.targetHost() != null && !StringUtils.hasText(draft.targetHost())) {
            throw new RegistryValidationException("Target host and port are required");
        }
        return registryStore.mutate(registry -> {
            Host current = requireHost(registry, id);
            Host updated = current
                .withTarget(
                    draft.targetHost() != null ? draft.targetHost().trim() : current.targetHost(),
                    draft.targetPort() != null ? draft.targetPort() : current.targetPort())
                .withFlags(
                    draft.localOnly() != null ? draft.localOnly() : current.localOnly(),
                    draft.requireAuth() != null ? draft.requireAuth() : current.requireAuth(),
                    draft.enabled() != null ? draft.enabled() : current.enabled());
            return RegistryChange.of(registry.replaceHost(id, host -> updated), updated);
        });
    }

    public MutationResult<Host> toggle(String id, boolean enabled) {
        MutationResult<Host> result = registryStore.mutate(registry -> {
            Host current = requireHost(registry, id);
            Host updated = current.withFlags(current.localOnly(), current.requireAuth(), enabled);
            return RegistryChange.of(registry.replaceHost(id, host -> updated), updated);
        });
        log.info("Host {} {}", id, enabled ? "enabled" : "disabled");
        return result;
    }

    public MutationResult<Host> delete(String id) {
        return registryStore.mutate(registry -> {
            Host removed = requireHost(registry, id);
            List<Host> hosts = new ArrayList<>(registry.hosts());
            hosts.remove(removed);
            return RegistryChange.of(registry.withHosts(hosts), removed);
        });
    }

    private static Host requireHost(Registry registry, String id) {
        return registry.findHost(id).orElseThrow(() -> new RegistryValidationException("Host not found"));
    }

    private static void requireValidPort(Integer port) {
        if (!HostnameRules.isValidPort(port)) {
            throw new RegistryValidationException("Invalid port number");
        }
    }
}
