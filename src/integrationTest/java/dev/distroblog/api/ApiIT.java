package dev.distroblog.api;

import dev.distroblog.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class ApiIT extends BaseIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @Test
    void manualTriggerWithoutSourcesReportsNothingNew() throws Exception {
        mockMvc.perform(post("/api/monitor/trigger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.newArticles").value(0))
                .andExpect(jsonPath("$.results").isEmpty());
    }

    @Test
    void statusStartsStopped() throws Exception {
        mockMvc.perform(get("/api/monitor/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("STOPPED"));
    }

    @Test
    void blankFeedUrlIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/feed/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"feedUrl\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", containsString("feedUrl")));
    }

    @Test
    void invalidManualUrlIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/articles/fetch-url")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"not a url\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("A valid article URL is required"));
    }

    @Test
    void nonPositiveEnrichmentLimitIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/maintenance/enrich-dates").param("limit", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void enrichmentWithNothingUndatedDatesNothing() throws Exception {
        mockMvc.perform(post("/api/maintenance/enrich-dates").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enriched").value(0));
    }
}
