package net.homeroute.service;

import lombok.extern.slf4j.Slf4j;
import net.homeroute.domain.registry.ApiEndpoint;
import net.homeroute.domain.registry.Application;
import net.homeroute.domain.registry.Endpoint;
import net.homeroute.domain.registry.EndpointSet;
import net.homeroute.domain.registry.Registry;
import net.homeroute.domain.registry.RegistryChange;
import net.homeroute.dto.ApiEndpointDraft;
import net.homeroute.dto.ApplicationDraft;
import net.homeroute.dto.EndpointDraft;
import net.homeroute.dto.EndpointSetDraft;
import net.homeroute.exception.RegistryValidationException;
import net.homeroute.util.HostnameRules;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * CRUD for applications and their per-environment endpoints.
 *
 * <p>Endpoints for environments that do not exist are skipped rather than
 * rejected, matching what the dashboard has always sent.</p>
 */
@Slf4j
@Service
public class ApplicationService {

    static final String DEFAULT_TARGET_HOST = "localhost";
    static final int DEFAULT_FRONTEND_PORT = 3000;
    static final int DEFAULT_API_PORT = 3001;

    private final RegistryStore registryStore;

    public ApplicationService(RegistryStore registryStore) {
        this.registryStore = registryStore;
    }

    public List<Application> list() {
        return registryStore.load().applications();
    }

    public MutationResult<Application> create(ApplicationDraft draft) {
        if (!StringUtils.hasText(draft.name()) || !StringUtils.hasText(draft.slug())) {
            throw new RegistryValidationException("Name and slug are required");
        }
        String slug = requireSlug(draft.slug());
        if (draft.endpoints() == null || draft.endpoints().isEmpty()) {
            throw new RegistryValidationException("At least one environment endpoint is required");
        }

        MutationResult<Application> result = registryStore.mutate(registry -> {
            Map<String, EndpointSet> endpoints = new LinkedHashMap<>();
            for (Map.Entry<String, EndpointSetDraft> entry : draft.endpoints().entrySet()) {
                String envId = entry.getKey();
                if (registry.findEnvironment(envId).isEmpty() || entry.getValue() == null) {
                    continue;
                }
                EndpointSetDraft set = entry.getValue();
                if (set.frontend() == null
                    || !StringUtils.hasText(set.frontend().targetHost())
                    || set.frontend().targetPort() == null) {
                    throw new RegistryValidationException("Frontend target is required for environment " + envId);
                }
                Endpoint frontend = toEndpoint(set.frontend(), DEFAULT_FRONTEND_PORT, "frontend", envId);
                List<ApiEndpoint> apis = toApis(set, envId);
                endpoints.put(envId, new EndpointSet(frontend, apis == null ? List.of() : apis));
            }
            if (endpoints.isEmpty()) {
                throw new RegistryValidationException("No valid environment endpoints provided");
            }

            Application created = new Application(
                UUID.randomUUID().toString(),
                draft.name().trim(),
                slug,
                true,
                endpoints,
                Instant.now().toString()
            );
            List<Application> applications = new ArrayList<>(registry.applications());
            applications.add(created);
            return RegistryChange.of(registry.withApplications(applications), created);
        });
        log.info("Added application {} in environment(s) {}", slug, result.value().endpoints().keySet());
        return result;
    }

    /**
     * Partial update. For each environment in {@code endpoints}: {@code null}
     * removes it, a missing frontend or API list keeps the stored one.
     */
    public MutationResult<Application> update(String id, ApplicationDraft draft) {
        String slug = StringUtils.hasText(draft.slug()) ? requireSlug(draft.slug()) : null;

        return registryStore.mutate(registry -> {
            Application current = requireApplication(registry, id);
            Application updated = current.withIdentity(
                StringUtils.hasText(draft.name()) ? draft.name().trim() : current.name(),
                slug != null ? slug : current.slug());
            if (draft.enabled() != null) {
                updated = updated.withEnabled(draft.enabled());
            }
            if (draft.endpoints() != null) {
                updated = updated.withEndpoints(mergeEndpoints(registry, current, draft.endpoints()));
            }
            Application result = updated;
            return RegistryChange.of(registry.replaceApplication(id, app -> result), result);
        });
    }

    public MutationResult<Application> toggle(String id, boolean enabled) {
        MutationResult<Application> result = registryStore.mutate(registry -> {
            Application updated = requireApplication(registry, id).withEnabled(enabled);
            return RegistryChange.of(registry.replaceApplication(id, app -> updated), updated);
        });
        log.info("Application {} {}", id, enabled ? "enabled" : "disabled");
        return result;
    }

    public MutationResult<Application> delete(String id) {
        return registryStore.mutate(registry -> {
            Application removed = requireApplication(registry, id);
            List<Application> applications = new ArrayList<>(registry.applications());
            applications.remove(removed);
            return RegistryChange.of(registry.withApplications(applications), removed);
        });
    }

    private Map<String, EndpointSet> mergeEndpoints(Registry registry,
                                                    Application current,
                                                    Map<String, EndpointSetDraft> changes) {
        Map<String, EndpointSet> merged = new LinkedHashMap<>(current.endpoints());
        for (Map.Entry<String, EndpointSetDraft> entry : changes.entrySet()) {
            String envId = entry.getKey();
            if (registry.findEnvironment(envId).isEmpty()) {
                continue;
            }
            EndpointSetDraft change = entry.getValue();
            if (change == null) {
                merged.remove(envId);
                continue;
            }
            EndpointSet existing = merged.get(envId);
            Endpoint frontend = change.frontend() != null
                ? toEndpoint(change.frontend(), DEFAULT_FRONTEND_PORT, "frontend", envId)
                : existing != null ? existing.frontend() : null;
            List<ApiEndpoint> apis = toApis(change, envId);
            if (apis == null) {
                apis = existing != null ? existing.apis() : List.of();
            }
            merged.put(envId, new EndpointSet(frontend, apis));
        }
        return merged;
    }

    /**
     * @return the requested API list, or {@code null} when the request carries neither {@code apis} nor {@code api}
     */
    private static List<ApiEndpoint> toApis(EndpointSetDraft set, String envId) {
        if (set.apis() != null) {
            List<ApiEndpoint> apis = new ArrayList<>();
            for (ApiEndpointDraft api : set.apis()) {
                if (api == null) {
                    continue;
                }
                Endpoint target = toEndpoint(
                    new EndpointDraft(api.targetHost(), api.targetPort(), api.localOnly(), api.requireAuth()),
                    DEFAULT_API_PORT, "API", envId);
                apis.add(new ApiEndpoint(HostnameRules.normalizeApiSlug(api.slug()),
                    target.targetHost(), target.targetPort(), target.localOnly(), target.requireAuth()));
            }
            return apis;
        }
        if (set.api() != null) {
            Endpoint target = toEndpoint(set.api(), DEFAULT_API_PORT, "API", envId);
            return List.of(new ApiEndpoint("", target.targetHost(), target.targetPort(),
                target.localOnly(), target.requireAuth()));
        }
        return null;
    }

    private static Endpoint toEndpoint(EndpointDraft draft, int defaultPort, String kind, String envId) {
        int port = draft.targetPort() != null ? draft.targetPort() : defaultPort;
        if (!HostnameRules.isValidPort(port)) {
            throw new RegistryValidationException("Invalid " + kind + " port for environment " + envId);
        }
        return new Endpoint(
            StringUtils.hasText(draft.targetHost()) ? draft.targetHost().trim() : DEFAULT_TARGET_HOST,
            port,
            Boolean.TRUE.equals(draft.localOnly()),
            Boolean.TRUE.equals(draft.requireAuth())
        );
    }

    private static String requireSlug(String raw) {
        String slug = HostnameRules.normalize(raw);
        if (!HostnameRules.isValidLabel(slug)) {
            throw new RegistryValidationException("Invalid slug format");
        }
        return slug;
    }

    private static Application requireApplication(Registry registry, String id) {
        return registry.findApplication(id)
            .orElseThrow(() -> new RegistryValidationException("Application not found"));
    }
}
