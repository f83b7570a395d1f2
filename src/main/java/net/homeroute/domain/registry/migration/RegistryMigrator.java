package net.homeroute.domain.registry.migration;

import lombok.extern.slf4j.Slf4j;
import net.homeroute.exception.RegistryStorageException;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies the migration chain until a document reaches {@link #CURRENT_VERSION}.
 * Documents without {@code schemaVersion} are treated as version 0.
 */
@Slf4j
@Component
public class RegistryMigrator {

    public static final int CURRENT_VERSION = 2;
    public static final String VERSION_FIELD = "schemaVersion";

    private final List<RegistryMigration> chain;

    public RegistryMigrator(List<RegistryMigration> migrations) {
        List<RegistryMigration> sorted = new ArrayList<>(migrations);
        sorted.sort(Comparator.comparingInt(RegistryMigration::fromVersion));
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).fromVersion() != i) {
                throw new IllegalStateException("Registry migration chain has a gap at version " + i);
            }
        }
        if (sorted.size() != CURRENT_VERSION) {
            throw new IllegalStateException("Registry migration chain ends at version " + sorted.size()
                + " but the current version is " + CURRENT_VERSION);
        }
        this.chain = List.copyOf(sorted);
    }

    public static int versionOf(ObjectNode document) {
        JsonNode version = document.get(VERSION_FIELD);
        return version == null ? 0 : version.asInt(0);
    }

    /**
     * @throws RegistryStorageException when the document was written by a newer release
     */
    public ObjectNode migrate(ObjectNode document) {
        int version = versionOf(document);
        if (version > CURRENT_VERSION) {
            throw new RegistryStorageException("Registry schema version " + version
                + " is newer than the supported version " + CURRENT_VERSION);
        }
        ObjectNode current = document;
        while (version < CURRENT_VERSION) {
            log.info("Migrating reverse-proxy registry from schema version {} to {}", version, version + 1);
            current = chain.get(version).apply(current);
            version++;
            current.put(VERSION_FIELD, version);
        }
        return current;
    }
}
