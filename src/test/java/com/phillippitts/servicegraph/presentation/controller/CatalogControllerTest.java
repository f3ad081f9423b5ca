package com.phillippitts.servicegraph.presentation.controller;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("integration")
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CatalogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void listsBuiltInCatalog() throws Exception {
        mockMvc.perform(get("/api/catalog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].name", hasItems("postgres", "gitea", "nginx")));
    }

    @Test
    void closureAddsDatabaseProvider() throws Exception {
        mockMvc.perform(get("/api/catalog/closure").param("service", "gitea"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requested[0]").value("gitea"))
                .andExpect(jsonPath("$.closure", hasItem("postgres")));
    }

    @Test
    void closureOfUnknownServiceIs404() throws Exception {
        mockMvc.perform(get("/api/catalog/closure").param("service", "gitlab"))
                .andExpect(status().isNotFound());
    }

    @Test
    void missingServiceParameterIs400() throws Exception {
        mockMvc.perform(get("/api/catalog/closure"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MalformedRequest"));
    }
}
