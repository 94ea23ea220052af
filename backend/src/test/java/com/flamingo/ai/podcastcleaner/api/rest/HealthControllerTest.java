package com.flamingo.ai.podcastcleaner.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.podcastcleaner.service.job.TranscriptJobService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

  @Mock private TranscriptJobService transcriptJobService;

  @Test
  @DisplayName("should report UP with cache and job counts")
  void shouldReportCounts_whenHealthRequested() throws Exception {
    when(transcriptJobService.cachedResultCount()).thenReturn(3);
    when(transcriptJobService.activeJobCount()).thenReturn(1);
    MockMvc mockMvc =
        MockMvcBuilders.standaloneSetup(new HealthController(transcriptJobService)).build();

    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.service").value("podcast-cleaner"))
        .andExpect(jsonPath("$.cachedResults").value(3))
        .andExpect(jsonPath("$.activeJobs").value(1))
        .andExpect(jsonPath("$.timestamp").exists());
  }
}
