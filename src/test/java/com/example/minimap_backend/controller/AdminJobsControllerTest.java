package com.example.minimap_backend.controller;

import com.example.minimap_backend.config.AdminProperties;
import com.example.minimap_backend.dto.Requester;
import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.model.RenderConfig;
import com.example.minimap_backend.service.JobAccessService;
import com.example.minimap_backend.util.DeletionOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AdminJobsController.class)
@AutoConfigureMockMvc(addFilters = false)
class AdminJobsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private JobAccessService accessService;
    @MockitoBean
    private AdminProperties adminProperties;

    @BeforeEach
    void setUp() {
        when(adminProperties.isEnabled()).thenReturn(true);
        when(adminProperties.getToken()).thenReturn("s3cret");
    }

    @Test
    void listsAllJobsWithValidToken() throws Exception {
        Job job = new Job(UUID.randomUUID(), "a.wowsreplay", "someone", RenderConfig.defaults(), Instant.EPOCH);
        when(accessService.listAll(Requester.administrator())).thenReturn(List.of(job));

        mockMvc.perform(get("/admin/jobs").header("X-Admin-Token", "s3cret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(job.getId().toString()));
    }

    @Test
    void wrongTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/admin/jobs").header("X-Admin-Token", "guess"))
                .andExpect(status().isUnauthorized());

        verify(accessService, never()).listAll(any());
    }

    @Test
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/admin/jobs"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void disabledAdminApiIsForbidden() throws Exception {
        when(adminProperties.isEnabled()).thenReturn(false);

        mockMvc.perform(delete("/admin/jobs").header("X-Admin-Token", "s3cret"))
                .andExpect(status().isForbidden());
    }

    @Test
    void adminDeleteReportsOutcome() throws Exception {
        UUID id = UUID.randomUUID();
        when(accessService.deleteJob(Requester.administrator(), id)).thenReturn(DeletionOutcome.DELETED);

        mockMvc.perform(delete("/admin/jobs/" + id).header("X-Admin-Token", "s3cret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("DELETED"));
    }
}
