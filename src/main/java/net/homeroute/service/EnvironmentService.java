package net.homeroute.service;

import lombok.extern.slf4j.Slf4j;
import net.homeroute.domain.registry.Environment;
import net.homeroute.domain.registry.Registry;
import net.homeroute.domain.registry.RegistryChange;
import net.homeroute.dto.EnvironmentDraft;
import net.homeroute.exception.ReferentialIntegrityException;
import net.homeroute.exception.RegistryValidationException;
import net.homeroute.util.HostnameRules;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * CRUD for environments. Prefix changes rename every application endpoint in
 * the environment, so updates go through the same collision checks as new entities.
 */
@Slf4j
@Service
public class EnvironmentService {

    private final RegistryStore registryStore;

    public EnvironmentService(RegistryStore registryStore) {
        this.registryStore = registryStore;
    }

    public List<Environment> list() {
        return registryStore.load().environments();
    }

    public MutationResult<Environment> create(EnvironmentDraft draft) {
        if (!StringUtils.hasText(draft.name()) || draft.prefix() == null || draft.apiPrefix() == null) {
            throw new RegistryValidationException("Name, prefix and apiPrefix are required");
        }
        String name = draft.name().trim();
        String prefix = requirePrefix(draft.prefix());
        String apiPrefix = requireApiPrefix(draft.apiPrefix());
        String id = HostnameRules.environmentIdFor(name);
        boolean isDefault = Boolean.TRUE.equals(draft.isDefault());

        MutationResult<Environment> result = registryStore.mutate(registry -> {
            if (registry.findEnvironment(id).isPresent()) {
                throw new RegistryValidationException("Environment with this name already exists");
            }
            Environment created = new Environment(id, name, prefix, apiPrefix, isDefault);
            List<Environment> environments = new ArrayList<>(isDefault
                ? clearDefault(registry.environments())
                : registry.environments());
            environments.add(created);
            return RegistryChange.of(registry.withEnvironments(environments), created);
        });
        log.info("Added environment {} (prefix '{}', api prefix '{}')", id, prefix, apiPrefix);
        return result;
    }

    /**
     * Updates name, prefixes and the default flag. The id stays stable so
     * application endpoint maps keep pointing at the environment.
     */
    public MutationResult<Environment> update(String id, EnvironmentDraft draft) {
        String prefix = draft.prefix() == null ? null : requirePrefix(draft.prefix());
        String apiPrefix = draft.apiPrefix() == null ? null : requireApiPrefix(draft.apiPrefix());
        if (draft.name() != null && !StringUtils.hasText(draft.name())) {
            throw new RegistryValidationException("Environment name cannot be empty");
        }

        return registryStore.mutate(registry -> {
            Environment current = requireEnvironment(registry, id);
            boolean isDefault = draft.isDefault() != null ? draft.isDefault() : current.isDefault();
            Environment updated = new Environment(
                id,
                draft.name() != null ? draft.name().trim() : current.name(),
                prefix != null ? prefix : current.prefix(),
                apiPrefix != null ? apiPrefix : current.apiPrefix(),
                isDefault
            );
            List<Environment> base = Boolean.TRUE.equals(draft.isDefault())
                ? clearDefault(registry.environments())
                : registry.environments();
            List<Environment> environments = new ArrayList<>(base.size());
            for (Environment env : base) {
                environments.add(id.equals(env.id()) ? updated : env);
            }
            return RegistryChange.of(registry.withEnvironments(environments), updated);
        });
    }

    /**
     * @throws ReferentialIntegrityException while any application still has endpoints in the environment
     */
    public MutationResult<Environment> delete(String id) {
        MutationResult<Environment> result = registryStore.mutate(registry -> {
            Environment removed = requireEnvironment(registry, id);
            long referencing = registry.applications().stream()
                .filter(app -> app.usesEnvironment(id))
                .count();
            if (referencing > 0) {
                throw new ReferentialIntegrityException(
                    "Cannot delete: " + referencing + " application(s) use this environment", (int) referencing);
            }
            List<Environment> environments = new ArrayList<>(registry.environments());
            environments.remove(removed);
            return RegistryChange.of(registry.withEnvironments(environments), removed);
        });
        log.info("Removed environment {}", id);
        return result;
    }

    private static List<Environment> clearDefault(List<Environment> environments) {
        return environments.stream().map(env -> env.withDefault(false)).toList();
    }

    private static Environment requireEnvironment(Registry registry, String id) {
        return registry.findEnvironment(id)
            .orElseThrow(() -> new RegistryValidationException("Environment not found"));
    }

    private static String requirePrefix(String raw) {
        String prefix = HostnameRules.normalize(raw);
        if (!HostnameRules.isValidPrefix(prefix, true)) {
            throw new RegistryValidationException("Invalid prefix format");
        }
        return prefix;
    }

    private static String requireApiPrefix(String raw) {
        String apiPrefix = HostnameRules.normalize(raw);
        if (!HostnameRules.isValidPrefix(apiPrefix, false)) {
            throw new RegistryValidationException("Invalid API prefix format");
        }
        return apiPrefix;
    }
}
