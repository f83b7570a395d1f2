package net.homeroute.domain.registry;

import jakarta.annotation.Nullable;

/**
 * Outcome of a mutation function: the registry to persist and the value
 * handed back to the caller (typically the created or updated entity).
 */
public record RegistryChange<T>(Registry registry, @Nullable T value) {

    public static <T> RegistryChange<T> of(Registry registry, @Nullable T value) {
        return new RegistryChange<>(registry, value);
    }
}
