package net.homeroute.service;

import jakarta.annotation.Nullable;
import net.homeroute.domain.registry.Registry;

/**
 * A persisted registry change and the outcome of applying it to the proxy.
 *
 * @param value value produced by the mutation, usually the touched entity
 * @param registry registry as saved, carrying the new revision
 * @param sync compile and push outcome; {@code applied == false} means saved but not applied
 */
public record MutationResult<T>(@Nullable T value, Registry registry, SyncReport sync) {
}
