package net.homeroute.service;

import net.homeroute.domain.registry.CloudflareSettings;
import net.homeroute.domain.registry.Registry;
import net.homeroute.domain.registry.RegistryChange;
import net.homeroute.domain.registry.migration.RegistryMigrator;
import net.homeroute.domain.routing.TlsStrategy;
import net.homeroute.exception.RegistryStorageException;
import net.homeroute.exception.RegistryValidationException;
import net.homeroute.exception.StaleRegistryException;
import net.homeroute.test.RegistryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static net.homeroute.test.RegistryFixtures.subdomainHost;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegistryStoreTest {

    @Mock
    private RouteSyncService routeSyncService;

    @TempDir
    Path directory;

    private RegistryStore store;

    @BeforeEach
    void setUp() {
        store = RegistryFixtures.store(directory, routeSyncService);
        lenient().when(routeSyncService.sync(any(Registry.class)))
            .thenReturn(SyncReport.applied(PushOutcome.unconfirmed(), 0, TlsStrategy.PER_HOST));
    }

    @Test
    void load_missingFileYieldsDefaults() {
        Registry registry = store.load();

        assertThat(registry.revision()).isZero();
        assertThat(registry.baseDomain()).isEmpty();
        assertThat(registry.schemaVersion()).isEqualTo(RegistryMigrator.CURRENT_VERSION);
        assertThat(registry.environments()).extracting(env -> env.id()).containsExactly("prod", "dev");
    }

    @Test
    void mutate_persistsBumpsRevisionAndSyncsSavedRegistry() {
        MutationResult<String> result = store.mutate(registry ->
            RegistryChange.of(registry.withBaseDomain("example.com"), "example.com"));

        assertThat(result.value()).isEqualTo("example.com");
        assertThat(result.registry().revision()).isEqualTo(1L);
        assertThat(store.load().baseDomain()).isEqualTo("example.com");
        assertThat(store.load().revision()).isEqualTo(1L);
        verify(routeSyncService).sync(result.registry());
    }

    @Test
    @DisplayName("A rejected change leaves the stored document and the proxy untouched")
    void mutate_invalidChangeWritesNothing() {
        store.mutate(registry -> RegistryChange.of(registry.withBaseDomain("example.com"), null));

        assertThatThrownBy(() -> store.mutate(registry -> RegistryChange.of(registry.withHosts(List.of(
            subdomainHost("h1", "proxy", "10.0.0.2", 80))), null)))
            .isInstanceOf(RegistryValidationException.class);

        assertThat(store.load().hosts()).isEmpty();
        assertThat(store.load().revision()).isEqualTo(1L);
    }

    @Test
    void save_rejectsStaleRevision() {
        Registry loaded = store.load();
        store.save(loaded.withBaseDomain("example.com"));

        assertThatThrownBy(() -> store.save(loaded.withBaseDomain("example.org")))
            .isInstanceOf(StaleRegistryException.class);
        assertThat(store.load().baseDomain()).isEqualTo("example.com");
    }

    @Test
    void mutate_failedPushStillPersists() {
        when(routeSyncService.sync(any(Registry.class)))
            .thenReturn(SyncReport.failed("Proxy admin API unreachable: Connection refused", 2, TlsStrategy.PER_HOST));

        MutationResult<String> result = store.mutate(registry ->
            RegistryChange.of(registry.withBaseDomain("example.com"), "example.com"));

        assertThat(result.sync().applied()).isFalse();
        assertThat(result.sync().error()).contains("unreachable");
        assertThat(store.load().baseDomain()).isEqualTo("example.com");
    }

    @Test
    void mutate_recomputesWildcardsWhileProviderEnabled() {
        store.mutate(registry -> RegistryChange.of(
            registry.withCloudflare(new CloudflareSettings(true, List.of())), null));
        store.mutate(registry -> RegistryChange.of(registry.withBaseDomain("example.com"), null));

        assertThat(store.load().cloudflare().wildcardDomains()).contains("*.example.com", "*.api.example.com");
    }

    @Test
    void load_migratesLegacyDocumentAndDropsDeprecatedKeys() throws IOException {
        Files.writeString(directory.resolve("registry.json"), """
            {"baseDomain":"example.com","wildcardCert":true,"applications":[
              {"id":"a1","name":"Shop","slug":"shop","frontend":{"targetHost":"10.0.0.5","targetPort":3000}}]}
            """, StandardCharsets.UTF_8);

        Registry registry = store.load();

        assertThat(registry.applications().get(0).endpoints()).containsOnlyKeys("prod");
        assertThat(registry.extensions()).doesNotContainKey("wildcardCert");

        Registry saved = store.save(registry);
        assertThat(saved.revision()).isEqualTo(1L);
        JsonNode written = RegistryFixtures.objectMapper()
            .readTree(Files.readString(directory.resolve("registry.json"), StandardCharsets.UTF_8));
        assertThat(written.get("schemaVersion").asInt()).isEqualTo(RegistryMigrator.CURRENT_VERSION);
        assertThat(written.has("wildcardCert")).isFalse();
        assertThat(written.at("/applications/0/endpoints/prod/frontend/targetPort").asInt()).isEqualTo(3000);
    }

    @Test
    void load_rejectsDocumentFromNewerRelease() throws IOException {
        Files.writeString(directory.resolve("registry.json"), "{\"schemaVersion\":7}", StandardCharsets.UTF_8);

        assertThatThrownBy(store::load).isInstanceOf(RegistryStorageException.class);
        verify(routeSyncService, never()).sync(any(Registry.class));
    }
}
