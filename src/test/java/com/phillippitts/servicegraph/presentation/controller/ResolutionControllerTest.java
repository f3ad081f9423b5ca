package com.phillippitts.servicegraph.presentation.controller;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("integration")
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ResolutionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void configuredResolutionReturnsStartupOrder() throws Exception {
        mockMvc.perform(get("/api/resolution"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fatal", hasSize(0)))
                .andExpect(jsonPath("$.startupOrder", contains("postgres", "gitea")));
    }

    @Test
    void unitDirectivesForEnabledService() throws Exception {
        mockMvc.perform(get("/api/units/gitea"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.wants", contains("postgres")))
                .andExpect(jsonPath("$.after[0]").value("postgres"));
    }

    @Test
    void unitDirectivesForDisabledServiceIs404() throws Exception {
        mockMvc.perform(get("/api/units/nginx"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("UnknownServiceException"));
    }

    @Test
    void postedConflictingServicesAreReportedNotRejected() throws Exception {
        String body = """
                {"services": [
                  {"name": "nginx", "port": 8080, "dataDir": "/var/lib/nginx"},
                  {"name": "traefik", "port": 8443, "dataDir": "/var/lib/traefik"}
                ]}
                """;

        mockMvc.perform(post("/api/resolution").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fatal[*].code", hasItem("CONFLICTING_SERVICES")))
                .andExpect(jsonPath("$.startupOrder").doesNotExist());
    }

    @Test
    void postedDatabaseUsesTypeLikeConfiguration() throws Exception {
        String body = """
                {"services": [
                  {"name": "postgres", "port": 5432, "dataDir": "/var/lib/postgresql"},
                  {"name": "gitea", "port": 3000, "dataDir": "/var/lib/gitea",
                   "database": {"type": "postgres"}}
                ]}
                """;

        mockMvc.perform(post("/api/resolution").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fatal[*].code", contains("MISSING_DATABASE_CREDENTIAL")))
                .andExpect(jsonPath("$.fatal[0].service").value("gitea"));
    }

    @Test
    void postedDuplicateNamesAre400() throws Exception {
        String body = """
                {"services": [
                  {"name": "postgres", "port": 5432, "dataDir": "/var/lib/postgresql"},
                  {"name": "postgres", "port": 5433, "dataDir": "/var/lib/pg2"}
                ]}
                """;

        mockMvc.perform(post("/api/resolution").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidServiceConfigurationException"));
    }

    @Test
    void malformedBodyIs400() throws Exception {
        mockMvc.perform(post("/api/resolution").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MalformedRequest"));
    }

    @Test
    void requestIdIsEchoed() throws Exception {
        mockMvc.perform(get("/api/resolution").header("X-Request-ID", "req-42"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-ID", "req-42"));
    }
}
