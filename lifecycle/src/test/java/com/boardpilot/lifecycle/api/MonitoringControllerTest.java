package com.boardpilot.lifecycle.api;

import com.boardpilot.lifecycle.model.TaskStatus;
import com.boardpilot.lifecycle.service.MonitoringService;
import com.boardpilot.lifecycle.service.MonitoringService.ActiveJobView;
import com.boardpilot.lifecycle.service.MonitoringService.Availability;
import com.boardpilot.lifecycle.service.MonitoringService.ReactivableTaskView;
import com.boardpilot.lifecycle.service.MonitoringService.ReactivationStats;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MonitoringController.class)
class MonitoringControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean MonitoringService monitoring;

    @Test
    void reactivableTasks_passesFilter() throws Exception {
        ReactivableTaskView view = new ReactivableTaskView(UUID.randomUUID(), "5012345678", "Fix login page",
                TaskStatus.FAILED, Availability.REACTIVABLE, 0, 1, 2, null, null, null);
        when(monitoring.reactivableTasks(true)).thenReturn(List.of(view));

        mockMvc.perform(get("/monitoring/reactivable-tasks").param("onlyReactivable", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].availability").value("REACTIVABLE"))
                .andExpect(jsonPath("$[0].failedReactivationAttempts").value(1));
    }

    @Test
    void activeJobs() throws Exception {
        ActiveJobView view = new ActiveJobView(UUID.randomUUID(), UUID.randomUUID(), "5012345678",
                TaskStatus.PROCESSING, Set.of("job-1"), false, Instant.parse("2026-03-01T10:00:00Z"),
                12, true, 1);
        when(monitoring.activeJobs()).thenReturn(List.of(view));

        mockMvc.perform(get("/monitoring/active-jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].jobIds[0]").value("job-1"))
                .andExpect(jsonPath("$[0].duplicate").value(false));
    }

    @Test
    void stats() throws Exception {
        when(monitoring.stats()).thenReturn(new ReactivationStats(10, 1, 2, 3, 0, 6, 1.5, 4,
                9, 7, Map.of("THROTTLED", 5L), 12.5));

        mockMvc.perform(get("/monitoring/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalTasks").value(10))
                .andExpect(jsonPath("$.rejectionsByReason.THROTTLED").value(5));
    }
}
