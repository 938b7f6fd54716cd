package com.gdin.inspection.citegraph.controller;

import jakarta.annotation.Resource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("dev")
@TestPropertySource(properties = "environment.test=true")
public class GraphControllerTest {

    @Resource
    private MockMvc mockMvc;

    @Test
    public void testMissingGraphIs404() throws Exception {
        mockMvc.perform(get("/api/graph/no-such-graph"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(404))
                .andExpect(jsonPath("$.data").value("GRAPH_NOT_FOUND"));
    }

    @Test
    public void testValidation() throws Exception {
        mockMvc.perform(post("/api/graph/build").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data").value("INVALID_REQUEST"));
    }

    @Test
    public void testListAndCancel() throws Exception {
        mockMvc.perform(get("/api/graphs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray());
        mockMvc.perform(delete("/api/graph/jobs/unknown-job"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(false));
    }
}
