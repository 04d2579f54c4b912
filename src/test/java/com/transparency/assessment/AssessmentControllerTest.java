package com.transparency.assessment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AssessmentControllerTest {
    private static final String TOKEN = "Bearer test-token";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ChatModel chatModel;

    @Test
    void rejectsCallsWithoutBearerToken() throws Exception {
        mockMvc.perform(post("/api/products/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody(newKey())))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));

        mockMvc.perform(get("/api/assessment/any/status").header(HttpHeaders.AUTHORIZATION, "Bearer  "))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void healthNeedsNoToken() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.database").value("UP"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void registersAnswersAndReportsStatusOverHttp() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(LlmStubs.reply("82"));
        String key = newKey();

        String body = mockMvc.perform(post("/api/products/register")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody(key)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.product_key").value(key))
                .andExpect(jsonPath("$.first_question").isNotEmpty())
                .andExpect(jsonPath("$.remaining_questions", hasSize(5)))
                .andReturn().getResponse().getContentAsString();
        String sessionId = objectMapper.readTree(body).get("session_id").asText();

        mockMvc.perform(post("/api/assessment/respond")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("session_id", sessionId, "message", "Full list attached"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(82))
                .andExpect(jsonPath("$.question_index").value(1))
                .andExpect(jsonPath("$.is_complete").value(false))
                .andExpect(jsonPath("$.fallback_score").value(false))
                .andExpect(jsonPath("$.remaining_questions", hasSize(5)))
                .andExpect(jsonPath("$.final_score").doesNotExist());

        mockMvc.perform(post("/api/assessment/respond-batch")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"" + sessionId + "\",\"responses\":[\"a\",\"b\",\"c\",\"d\",\"e\",\"f\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.questions_answered").value(5))
                .andExpect(jsonPath("$.discarded_answers").value(1))
                .andExpect(jsonPath("$.is_complete").value(true))
                .andExpect(jsonPath("$.final_score").value(82.0))
                .andExpect(jsonPath("$.all_scores", hasSize(6)));

        mockMvc.perform(get("/api/assessment/{id}/status", sessionId).header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.answered_count").value(6))
                .andExpect(jsonPath("$.current_question_index").value(7))
                .andExpect(jsonPath("$.next_question").doesNotExist());

        mockMvc.perform(post("/api/assessment/respond")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("session_id", sessionId, "message", "again"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("ALREADY_COMPLETED"))
                .andExpect(jsonPath("$.final_score").value(82.0));

        mockMvc.perform(get("/api/assessment/{id}/events", sessionId).header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].event_type").value("product_registered"));
    }

    @Test
    void mapsClientErrorsToDistinctStatusCodes() throws Exception {
        String key = newKey();
        mockMvc.perform(post("/api/products/register")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody(key)))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/products/register")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody(key)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DUPLICATE_PRODUCT"));

        mockMvc.perform(post("/api/products/register")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"company_name\":\"Acme\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.details[0].code").value("MISSING_FIELD"));

        mockMvc.perform(post("/api/assessment/respond")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"nope\",\"message\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].code").value("EMPTY_ANSWER"));

        mockMvc.perform(post("/api/assessment/respond")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));

        mockMvc.perform(get("/api/assessment/{id}/status", "unknown-session").header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("SESSION_NOT_FOUND"));

        mockMvc.perform(get("/api/assessment/{id}/report", "unknown-session").header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isNotFound());
    }

    @Test
    void listsRegisteredProducts() throws Exception {
        String key = newKey();
        mockMvc.perform(post("/api/products/register")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody(key)))
                .andExpect(status().isCreated());

        String list = mockMvc.perform(get("/api/products").header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode products = objectMapper.readTree(list);
        long matches = 0;
        for (JsonNode p : products) {
            if (key.equals(p.get("product_key").asText())) {
                matches++;
            }
        }
        assertEquals(1, matches);

        mockMvc.perform(get("/api/products/{key}", key).header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.product.company_name").value("Acme"))
                .andExpect(jsonPath("$.sessions", hasSize(1)))
                .andExpect(jsonPath("$.sessions[0].status").value("active"));
    }

    private String newKey() {
        return "http-" + UUID.randomUUID();
    }

    private String registerBody(String key) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
                "company_name", "Acme",
                "product_name", "Face Cream",
                "product_id", key,
                "description", "Moisturising cream",
                "domain", "cosmetics"));
    }
}
