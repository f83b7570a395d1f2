package net.homeroute.service;

import net.homeroute.domain.registry.ApiEndpoint;
import net.homeroute.domain.registry.Application;
import net.homeroute.domain.registry.EndpointSet;
import net.homeroute.domain.registry.Registry;
import net.homeroute.domain.registry.RegistryChange;
import net.homeroute.domain.routing.TlsStrategy;
import net.homeroute.dto.ApiEndpointDraft;
import net.homeroute.dto.ApplicationDraft;
import net.homeroute.dto.EndpointDraft;
import net.homeroute.dto.EndpointSetDraft;
import net.homeroute.exception.RegistryValidationException;
import net.homeroute.test.RegistryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class ApplicationServiceTest {

    @Mock
    private RouteSyncService routeSyncService;

    @TempDir
    Path directory;

    private ApplicationService applicationService;

    @BeforeEach
    void setUp() {
        lenient().when(routeSyncService.sync(any(Registry.class)))
            .thenReturn(SyncReport.applied(PushOutcome.unconfirmed(), 0, TlsStrategy.PER_HOST));
        RegistryStore store = RegistryFixtures.store(directory, routeSyncService);
        store.mutate(registry -> RegistryChange.of(registry.withBaseDomain("example.com"), null));
        applicationService = new ApplicationService(store);
    }

    @Test
    void create_keepsEnvironmentOrderAndSkipsUnknownEnvironments() {
        Map<String, EndpointSetDraft> endpoints = new LinkedHashMap<>();
        endpoints.put("dev", new EndpointSetDraft(frontend("10.0.0.7", 5173), null, null));
        endpoints.put("qa", new EndpointSetDraft(frontend("10.0.0.8", 3000), null, null));
        endpoints.put("prod", new EndpointSetDraft(frontend("10.0.0.5", 3000), List.of(
            new ApiEndpointDraft("Admin", "10.0.0.5", 3002, null, true),
            new ApiEndpointDraft(null, "10.0.0.5", null, null, null)), null));

        Application app = applicationService.create(new ApplicationDraft("Shop", "Shop", null, endpoints)).value();

        assertThat(app.slug()).isEqualTo("shop");
        assertThat(app.enabled()).isTrue();
        assertThat(app.endpoints().keySet()).containsExactly("dev", "prod");
        List<ApiEndpoint> apis = app.endpoints().get("prod").apis();
        assertThat(apis).extracting(ApiEndpoint::slug).containsExactly("admin", "");
        assertThat(apis.get(1).targetPort()).isEqualTo(ApplicationService.DEFAULT_API_PORT);
        assertThat(app.endpoints().get("dev").apis()).isEmpty();
    }

    @Test
    @DisplayName("Single legacy api field becomes one unnamed API")
    void create_acceptsLegacySingleApi() {
        Map<String, EndpointSetDraft> endpoints = Map.of("prod", new EndpointSetDraft(
            frontend("10.0.0.5", 3000), null, new EndpointDraft("10.0.0.5", 3001, true, false)));

        Application app = applicationService.create(new ApplicationDraft("Shop", "shop", null, endpoints)).value();

        assertThat(app.endpoints().get("prod").apis())
            .containsExactly(new ApiEndpoint("", "10.0.0.5", 3001, true, false));
    }

    @Test
    void create_rejectsInvalidRequests() {
        Map<String, EndpointSetDraft> good = Map.of("prod", new EndpointSetDraft(frontend("10.0.0.5", 3000), null, null));

        assertThatThrownBy(() -> applicationService.create(new ApplicationDraft("Shop", "", null, good)))
            .hasMessage("Name and slug are required");
        assertThatThrownBy(() -> applicationService.create(new ApplicationDraft("Shop", "sh op", null, good)))
            .hasMessage("Invalid slug format");
        assertThatThrownBy(() -> applicationService.create(new ApplicationDraft("Shop", "shop", null, Map.of())))
            .hasMessage("At least one environment endpoint is required");
        assertThatThrownBy(() -> applicationService.create(new ApplicationDraft("Shop", "shop", null,
            Map.of("prod", new EndpointSetDraft(null, null, null)))))
            .hasMessage("Frontend target is required for environment prod");
        assertThatThrownBy(() -> applicationService.create(new ApplicationDraft("Shop", "shop", null,
            Map.of("qa", new EndpointSetDraft(frontend("10.0.0.5", 3000), null, null)))))
            .hasMessage("No valid environment endpoints provided");
    }

    @Test
    void create_rejectsSlugAlreadyInUse() {
        Map<String, EndpointSetDraft> endpoints = Map.of("prod", new EndpointSetDraft(frontend("10.0.0.5", 3000), null, null));
        applicationService.create(new ApplicationDraft("Shop", "shop", null, endpoints));

        assertThatThrownBy(() -> applicationService.create(new ApplicationDraft("Shop 2", "shop", null,
            Map.of("dev", new EndpointSetDraft(frontend("10.0.0.6", 3000), null, null)))))
            .isInstanceOf(RegistryValidationException.class)
            .hasMessage("Application with this slug already exists");
    }

    @Test
    void update_mergesEndpointsPerEnvironment() {
        Map<String, EndpointSetDraft> endpoints = new LinkedHashMap<>();
        endpoints.put("prod", new EndpointSetDraft(frontend("10.0.0.5", 3000),
            List.of(new ApiEndpointDraft("", "10.0.0.5", 3001, null, null)), null));
        endpoints.put("dev", new EndpointSetDraft(frontend("10.0.0.7", 5173), null, null));
        Application created = applicationService.create(new ApplicationDraft("Shop", "shop", null, endpoints)).value();

        Map<String, EndpointSetDraft> changes = new HashMap<>();
        changes.put("prod", new EndpointSetDraft(frontend("10.0.0.9", 8080), null, null));
        changes.put("dev", null);
        Application updated = applicationService.update(created.id(),
            new ApplicationDraft(null, null, false, changes)).value();

        assertThat(updated.enabled()).isFalse();
        assertThat(updated.slug()).isEqualTo("shop");
        assertThat(updated.endpoints()).containsOnlyKeys("prod");
        EndpointSet prod = updated.endpoints().get("prod");
        assertThat(prod.frontend().targetPort()).isEqualTo(8080);
        assertThat(prod.apis()).extracting(ApiEndpoint::targetPort).containsExactly(3001);
    }

    @Test
    void toggleAndDelete() {
        Map<String, EndpointSetDraft> endpoints = Map.of("prod", new EndpointSetDraft(frontend("10.0.0.5", 3000), null, null));
        Application created = applicationService.create(new ApplicationDraft("Shop", "shop", null, endpoints)).value();

        assertThat(applicationService.toggle(created.id(), false).value().enabled()).isFalse();
        applicationService.delete(created.id());

        assertThat(applicationService.list()).isEmpty();
        assertThatThrownBy(() -> applicationService.delete(created.id()))
            .hasMessage("Application not found");
    }

    private static EndpointDraft frontend(String host, int port) {
        return new EndpointDraft(host, port, null, null);
    }
}
