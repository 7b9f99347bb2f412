package com.cineplexx.rss.sync.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.emptyOrNullString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class SyncApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void statusShowsBothJobsBeforeAnyRun() throws Exception {
        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.runId").value(not(emptyOrNullString())))
            .andExpect(jsonPath("$.cineplexxJob.enabled").value(true))
            .andExpect(jsonPath("$.telegramJob.enabled").value(true));
    }

    @Test
    void feedsListCatalogThenNormalizedChannels() throws Exception {
        mockMvc.perform(get("/api/feeds"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(3))
            .andExpect(jsonPath("$[0].href").value("cineplexx_rss.xml"))
            .andExpect(jsonPath("$[1].href").value("durov.xml"))
            .andExpect(jsonPath("$[2].href").value("telegram.xml"))
            .andExpect(jsonPath("$[2].subtitle").value("@telegram"));
    }

    @Test
    void schedulerIsIdleInTests() throws Exception {
        mockMvc.perform(get("/api/scheduler"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false));
    }

    @Test
    void statusEndpointIsGetOnly() throws Exception {
        mockMvc.perform(post("/api/status"))
            .andExpect(status().isMethodNotAllowed());
    }
}
