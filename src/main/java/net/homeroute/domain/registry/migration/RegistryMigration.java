package net.homeroute.domain.registry.migration;

import tools.jackson.databind.node.ObjectNode;

/**
 * Rewrites a persisted registry document from {@link #fromVersion()} to
 * {@code fromVersion() + 1}. Migrations operate on the raw JSON tree so they
 * never depend on the current typed model.
 */
public interface RegistryMigration {

    int fromVersion();

    /**
     * @param document document at {@link #fromVersion()}; may be modified in place
     * @return the document at the next version
     */
    ObjectNode apply(ObjectNode document);
}
