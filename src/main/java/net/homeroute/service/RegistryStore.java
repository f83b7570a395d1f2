package net.homeroute.service;

import net.homeroute.adapters.persistence.RegistryDocumentCodec;
import net.homeroute.adapters.persistence.RegistryFileRepository;
import net.homeroute.domain.registry.CloudflareSettings;
import net.homeroute.domain.registry.Registry;
import net.homeroute.domain.registry.RegistryChange;
import net.homeroute.domain.registry.RegistryDefaults;
import net.homeroute.domain.registry.RegistryValidator;
import net.homeroute.domain.registry.migration.RegistryMigrator;
import net.homeroute.domain.routing.TlsPolicyBuilder;
import net.homeroute.exception.RegistryStorageException;
import net.homeroute.exception.RegistryValidationException;
import net.homeroute.exception.StaleRegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.databind.node.ObjectNode;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owns the persisted registry document.
 *
 * <p>There is no lock around read-modify-write. Concurrent writers are detected
 * through the {@code revision} counter instead: a save whose revision no longer
 * matches the stored one is rejected with {@link StaleRegistryException}.</p>
 */
@Service
public class RegistryStore {

    private static final Logger log = LoggerFactory.getLogger(RegistryStore.class);

    private final RegistryFileRepository repository;
    private final RegistryDocumentCodec codec;
    private final RegistryMigrator migrator;
    private final RouteSyncService routeSyncService;
    private final ReentrantLock saveLock = new ReentrantLock();

    public RegistryStore(RegistryFileRepository repository,
                         RegistryDocumentCodec codec,
                         RegistryMigrator migrator,
                         RouteSyncService routeSyncService) {
        this.repository = repository;
        this.codec = codec;
        this.migrator = migrator;
        this.routeSyncService = routeSyncService;
    }

    /**
     * Reads the current registry, migrating older documents in memory. A missing
     * file yields the default registry at revision 0.
     *
     * @throws RegistryStorageException when the document is unreadable or newer than supported
     */
    public Registry load() {
        Optional<ObjectNode> stored = repository.read();
        if (stored.isEmpty()) {
            return RegistryDefaults.emptyRegistry(RegistryMigrator.CURRENT_VERSION);
        }
        ObjectNode document = migrator.migrate(codec.normalize(stored.get()));
        return codec.toRegistry(document);
    }

    /**
     * Writes {@code registry} if nobody saved since it was loaded.
     *
     * @return the saved registry, carrying {@code revision + 1}
     * @throws StaleRegistryException when the stored revision differs from {@code registry.revision()}
     */
    public Registry save(Registry registry) {
        saveLock.lock();
        try {
            long storedRevision = repository.read()
                .map(document -> document.path("revision").asLong(0L))
                .orElse(0L);
            if (storedRevision != registry.revision()) {
                throw new StaleRegistryException(registry.revision(), storedRevision);
            }
            Registry next = registry.withRevision(registry.revision() + 1);
            repository.write(codec.toDocument(next));
            log.debug("Saved registry revision {} to {}", next.revision(), repository.getFile());
            return next;
        } finally {
            saveLock.unlock();
        }
    }

    /**
     * Load, apply {@code change}, re-derive wildcard patterns, validate, save,
     * then compile and push. A failed push does not undo the save; it is
     * reported through {@link MutationResult#sync()}.
     *
     * @throws RegistryValidationException when the changed registry breaks an invariant; nothing is written
     * @throws StaleRegistryException when another writer saved in between
     */
    public <T> MutationResult<T> mutate(Function<Registry, RegistryChange<T>> change) {
        Registry current = load();
        RegistryChange<T> applied = change.apply(current);
        Registry candidate = withDerivedWildcards(applied.registry());
        RegistryValidator.validate(candidate);
        Registry saved = save(candidate);
        SyncReport report = routeSyncService.sync(saved);
        return new MutationResult<>(applied.value(), saved, report);
    }

    /**
     * Pushes the current registry again without changing it.
     */
    public SyncReport resync() {
        return routeSyncService.sync(load());
    }

    static Registry withDerivedWildcards(Registry registry) {
        if (!registry.cloudflare().enabled()) {
            return registry;
        }
        return registry.withCloudflare(new CloudflareSettings(true, TlsPolicyBuilder.deriveWildcardDomains(registry)));
    }
}
