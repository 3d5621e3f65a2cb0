package com.delta.archivescraper.archive;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ArchiveApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void pacerStatusReportsTheConfiguredMode() throws Exception {
        mockMvc.perform(get("/api/pacer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.paceMode").value("manual"))
            .andExpect(jsonPath("$.requestsIssued").isNumber());
    }

    @Test
    void fetchEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/fetch"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void invalidFetchIsRejectedWith400() throws Exception {
        mockMvc.perform(post("/api/fetch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"mode\":\"submissions\",\"subreddit\":\"java\",\"limit\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    @Test
    void unknownModeIsRejectedWith400() throws Exception {
        mockMvc.perform(post("/api/fetch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"mode\":\"users\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(containsString("submissions")));
    }

    @Test
    void unreachableArchiveIsReportedAsFailedFetch() throws Exception {
        mockMvc.perform(post("/api/fetch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"mode\":\"submissions\",\"subreddit\":\"java\",\"limit\":3}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.status").value("failed"))
            .andExpect(jsonPath("$.reasonCode").value("RETRY_EXHAUSTED"))
            .andExpect(jsonPath("$.recordCount").value(0));
    }
}
