package com.socialgenius.browseruse.backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialgenius.browseruse.backend.BaseE2ETest;
import com.socialgenius.browseruse.backend.agent.AgentResult;
import com.socialgenius.browseruse.backend.agent.BrowserAgent;
import com.socialgenius.browseruse.backend.agent.BrowsingContext;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class AuthTaskFlowE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private BrowserAgent browserAgent;

    @MockBean
    private BrowsingContext browsingContext;

    @Test
    void shouldRunSubmittedTaskToCompletion() throws Exception {
        // Given
        when(browserAgent.run(any(), any(), any()))
                .thenReturn(new AgentResult("I successfully logged in to the account.", true));

        // When
        String body = mockMvc.perform(post("/v1/google-auth")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"owner@example.com","password":"s3cret","businessId":"biz-e2e",
                                 "timeout":10000}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("pending"))
                .andReturn().getResponse().getContentAsString();
        String taskId = objectMapper.readTree(body).get("task_id").asText();

        // Then
        JsonNode task = null;
        long deadline = System.currentTimeMillis() + 10000;
        while (System.currentTimeMillis() < deadline) {
            task = objectMapper.readTree(mockMvc.perform(get("/v1/task/" + taskId))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString());
            if (!"pending".equals(task.get("status").asText())) {
                break;
            }
            Thread.sleep(50);
        }
        assertNotNull(task);
        assertEquals("completed", task.get("status").asText());
        assertTrue(task.get("result").get("success").asBoolean());
        assertFalse(task.get("result").get("session_saved").asBoolean());
        assertTrue(task.hasNonNull("completed_at"));
    }

    @Test
    void shouldReturnNotFoundForUnknownTask() throws Exception {
        mockMvc.perform(get("/v1/task/does-not-exist"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldServeHealthAndStatus() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
        mockMvc.perform(get("/v1/browser/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.streaming_supported").value(false));
    }
}
