package net.homeroute.controller;

import net.homeroute.adapters.persistence.RegistryDocumentCodec;
import net.homeroute.domain.registry.Host;
import net.homeroute.domain.routing.TlsStrategy;
import net.homeroute.dto.HostDraft;
import net.homeroute.exception.RegistryValidationException;
import net.homeroute.service.ConvergenceState;
import net.homeroute.service.HostService;
import net.homeroute.service.MutationResult;
import net.homeroute.service.PushOutcome;
import net.homeroute.service.SyncReport;
import net.homeroute.test.RegistryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class HostControllerTest {

    @Mock
    private HostService hostService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        HostController controller = new HostController(hostService,
            new RegistryDocumentCodec(RegistryFixtures.objectMapper()));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ReverseProxyExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("GET /api/reverseproxy/hosts lists hosts")
    void list_returnsHosts() throws Exception {
        when(hostService.list()).thenReturn(List.of(
            RegistryFixtures.subdomainHost("h1", "nas", "10.0.0.2", 5000)));

        mockMvc.perform(get("/api/reverseproxy/hosts"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.hosts", hasSize(1)))
            .andExpect(jsonPath("$.hosts[0].subdomain").value("nas"))
            .andExpect(jsonPath("$.hosts[0].targetPort").value(5000));
    }

    @Test
    @DisplayName("POST /api/reverseproxy/hosts returns the host with its sync state")
    void create_returnsHostAndSyncState() throws Exception {
        Host host = RegistryFixtures.subdomainHost("h1", "nas", "10.0.0.2", 5000);
        SyncReport sync = SyncReport.applied(new PushOutcome(ConvergenceState.CONFIRMED, List.of()), 3, TlsStrategy.PER_HOST);
        when(hostService.create(any(HostDraft.class))).thenReturn(new MutationResult<>(host, null, sync));

        mockMvc.perform(post("/api/reverseproxy/hosts")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"subdomain\":\"nas\",\"targetHost\":\"10.0.0.2\",\"targetPort\":5000}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.host.id").value("h1"))
            .andExpect(jsonPath("$.applied").value(true))
            .andExpect(jsonPath("$.converged").value(true));

        verify(hostService).create(new HostDraft("nas", null, "10.0.0.2", 5000, null, null, null));
    }

    @Test
    void create_reportsSavedButNotApplied() throws Exception {
        Host host = RegistryFixtures.subdomainHost("h1", "nas", "10.0.0.2", 5000);
        SyncReport sync = SyncReport.failed("Proxy admin API unreachable: Connection refused", 3, TlsStrategy.PER_HOST);
        when(hostService.create(any(HostDraft.class))).thenReturn(new MutationResult<>(host, null, sync));

        mockMvc.perform(post("/api/reverseproxy/hosts")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"subdomain\":\"nas\",\"targetHost\":\"10.0.0.2\",\"targetPort\":5000}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.applied").value(false))
            .andExpect(jsonPath("$.applyError").value("Proxy admin API unreachable: Connection refused"))
            .andExpect(jsonPath("$.converged").doesNotExist());
    }

    @Test
    void create_reportsValidationErrorInBody() throws Exception {
        when(hostService.create(any(HostDraft.class)))
            .thenThrow(new RegistryValidationException("Invalid subdomain format"));

        mockMvc.perform(post("/api/reverseproxy/hosts")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"subdomain\":\"-bad\",\"targetHost\":\"10.0.0.2\",\"targetPort\":5000}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Invalid subdomain format"));
    }

    @Test
    void toggle_passesRequestedState() throws Exception {
        Host host = RegistryFixtures.subdomainHost("h1", "nas", "10.0.0.2", 5000)
            .withFlags(false, false, false);
        SyncReport sync = SyncReport.applied(PushOutcome.unconfirmed(), 0, TlsStrategy.PER_HOST);
        when(hostService.toggle(eq("h1"), eq(false))).thenReturn(new MutationResult<>(host, null, sync));

        mockMvc.perform(post("/api/reverseproxy/hosts/h1/toggle")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"enabled\":false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.host.enabled").value(false))
            .andExpect(jsonPath("$.converged").doesNotExist());
    }

    @Test
    void delete_unknownHostIsReported() throws Exception {
        when(hostService.delete("missing")).thenThrow(new RegistryValidationException("Host not found"));

        mockMvc.perform(delete("/api/reverseproxy/hosts/missing"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Host not found"));
    }

    @Test
    void malformedBodyIsReportedAsInvalidRequest() throws Exception {
        mockMvc.perform(post("/api/reverseproxy/hosts")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Invalid request body"));
    }
}
