package net.homeroute.controller;

import net.homeroute.adapters.persistence.RegistryDocumentCodec;
import net.homeroute.domain.registry.Environment;
import net.homeroute.domain.registry.RegistryDefaults;
import net.homeroute.domain.routing.TlsStrategy;
import net.homeroute.dto.EnvironmentDraft;
import net.homeroute.exception.ReferentialIntegrityException;
import net.homeroute.service.EnvironmentService;
import net.homeroute.service.MutationResult;
import net.homeroute.service.PushOutcome;
import net.homeroute.service.SyncReport;
import net.homeroute.test.RegistryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class EnvironmentControllerTest {

    @Mock
    private EnvironmentService environmentService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        EnvironmentController controller = new EnvironmentController(environmentService,
            new RegistryDocumentCodec(RegistryFixtures.objectMapper()));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ReverseProxyExceptionHandler())
            .build();
    }

    @Test
    void list_writesIsDefaultFlag() throws Exception {
        when(environmentService.list()).thenReturn(RegistryDefaults.environments());

        mockMvc.perform(get("/api/reverseproxy/environments"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.environments", hasSize(2)))
            .andExpect(jsonPath("$.environments[0].id").value("prod"))
            .andExpect(jsonPath("$.environments[0].isDefault").value(true))
            .andExpect(jsonPath("$.environments[1].apiPrefix").value("api.dev"));
    }

    @Test
    void create_readsIsDefaultProperty() throws Exception {
        Environment staging = new Environment("staging", "Staging", "stage", "api.stage", false);
        when(environmentService.create(any(EnvironmentDraft.class))).thenReturn(new MutationResult<>(staging, null,
            SyncReport.applied(PushOutcome.unconfirmed(), 2, TlsStrategy.PER_HOST)));

        mockMvc.perform(post("/api/reverseproxy/environments")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Staging\",\"prefix\":\"stage\",\"apiPrefix\":\"api.stage\",\"isDefault\":false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.environment.prefix").value("stage"))
            .andExpect(jsonPath("$.applied").value(true));

        verify(environmentService).create(new EnvironmentDraft("Staging", "stage", "api.stage", false));
    }

    @Test
    void delete_inUseEnvironmentReportsReferencingApplications() throws Exception {
        when(environmentService.delete("dev")).thenThrow(
            new ReferentialIntegrityException("Cannot delete: 2 application(s) use this environment", 2));

        mockMvc.perform(delete("/api/reverseproxy/environments/dev"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Cannot delete: 2 application(s) use this environment"))
            .andExpect(jsonPath("$.referencingApplications").value(2));
    }
}
