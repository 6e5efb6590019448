package com.propertyintel.estate.config;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.propertyintel.estate.model.ScrapeRun;
import com.propertyintel.estate.service.EstateCrawlService;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ScrapeControllerTest {

    private EstateCrawlService crawlService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        crawlService = mock(EstateCrawlService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ScrapeController(crawlService, new EstateScraperProperties()))
                .build();
    }

    @Test
    void testTriggerWhileRunningIsConflict() throws Exception {
        // Given
        when(crawlService.isRunning()).thenReturn(true);

        // When/Then
        mockMvc.perform(post("/scrape/trigger"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("already-running"));
        verify(crawlService, never()).crawl();
    }

    @Test
    void testTriggerIsAccepted() throws Exception {
        // Given
        when(crawlService.isRunning()).thenReturn(false);

        // When/Then
        mockMvc.perform(post("/scrape/trigger"))
                .andExpect(status().isAccepted());
        verify(crawlService, timeout(2000)).crawl();
    }

    @Test
    void testStatusShowsLastRun() throws Exception {
        // Given
        when(crawlService.getLastRun()).thenReturn(Optional.of(
                ScrapeRun.builder().runId("r-1").status("SUCCESS").recordsWritten(12L).build()));
        when(crawlService.getLastReport()).thenReturn(Optional.empty());

        // When/Then
        mockMvc.perform(get("/scrape/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outputMode").value("CSV"))
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.lastRun.runId").value("r-1"))
                .andExpect(jsonPath("$.lastRun.status").value("SUCCESS"));
    }
}
