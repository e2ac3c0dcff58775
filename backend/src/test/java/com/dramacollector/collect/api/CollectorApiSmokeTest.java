package com.dramacollector.collect.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class CollectorApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void startEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/jobs/start"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void manualJobCollectsFromMockSourceAndStores() throws Exception {
        String body = mockMvc.perform(post("/api/jobs/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"count\": 5, \"exportEnabled\": false, \"qualityThreshold\": 5.0}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.jobId").isNotEmpty())
            .andReturn()
            .getResponse()
            .getContentAsString();
        String jobId = objectMapper.readTree(body).path("jobId").asText();

        JsonNode job = awaitFinished(jobId);
        assertThat(job.path("state").asText()).isEqualTo("COMPLETED");
        assertThat(job.path("totalCollected").asInt()).isEqualTo(5);
        assertThat(job.path("totalStored").asInt()).isEqualTo(5);
        assertThat(job.path("endTime").asText()).isNotBlank();

        mockMvc.perform(get("/api/dramas").param("limit", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(3));

        mockMvc.perform(get("/api/dramas").param("genre", "军旅"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].title").value("军婚甜宠：首长老公太霸道"));

        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.storeReachable").value(true))
            .andExpect(jsonPath("$.storedDramas").value(greaterThanOrEqualTo(5)))
            .andExpect(jsonPath("$.scheduler.running").value(false));
    }

    @Test
    void currentJobIsEmptyWhenIdle() throws Exception {
        mockMvc.perform(get("/api/jobs/current"))
            .andExpect(status().isNoContent());
    }

    @Test
    void unknownDramaIsNotFound() throws Exception {
        mockMvc.perform(get("/api/dramas/{key}", "nothing|1900"))
            .andExpect(status().isNotFound());
    }

    @Test
    void configHidesCredentials() throws Exception {
        String body = mockMvc.perform(get("/api/config"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sources.douban.apiKeyConfigured").value(false))
            .andExpect(jsonPath("$.processing.validationLevel").value("MODERATE"))
            .andReturn()
            .getResponse()
            .getContentAsString();

        assertThat(body).doesNotContain("\"apiKey\"");
    }

    @Test
    void sourcesAreListedByPriority() throws Exception {
        mockMvc.perform(get("/api/sources"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name").value("douban"))
            .andExpect(jsonPath("$[0].enabled").value(false))
            .andExpect(jsonPath("$[2].name").value("mock"))
            .andExpect(jsonPath("$[2].enabled").value(true));
    }

    @Test
    void invalidThresholdIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/jobs/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"qualityThreshold\": 11}"))
            .andExpect(status().isBadRequest());
    }

    private JsonNode awaitFinished(String jobId) throws Exception {
        long deadline = System.currentTimeMillis() + 15_000;
        while (System.currentTimeMillis() < deadline) {
            String history = mockMvc.perform(get("/api/jobs/history").param("limit", "20"))
                .andExpect(status().isOk())
                .andReturn()
                .getResponse()
                .getContentAsString();
            for (JsonNode job : objectMapper.readTree(history)) {
                if (job.path("id").asText().equals(jobId)) {
                    String state = job.path("state").asText();
                    if (state.equals("COMPLETED") || state.equals("ERROR")) {
                        return job;
                    }
                }
            }
            Thread.sleep(50);
        }
        throw new AssertionError("job " + jobId + " did not finish in time");
    }
}
