package com.tokengate.controller;

import com.tokengate.model.SweepReport;
import com.tokengate.service.ReverificationScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ReverificationController.class)
class ReverificationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReverificationScheduler scheduler;

    @Test
    void runSweep_success() throws Exception {
        when(scheduler.runSweepOnce(SweepReport.Trigger.MANUAL)).thenReturn(SweepReport.builder()
                .trigger(SweepReport.Trigger.MANUAL)
                .groupsScanned(2)
                .usersChecked(5)
                .retained(4)
                .evicted(1)
                .build());

        mockMvc.perform(post("/api/v1/reverification/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trigger").value("MANUAL"))
                .andExpect(jsonPath("$.usersChecked").value(5))
                .andExpect(jsonPath("$.evicted").value(1))
                .andExpect(jsonPath("$.skipped").value(false));
    }

    @Test
    void runSweep_alreadyRunning_returnsConflict() throws Exception {
        when(scheduler.runSweepOnce(SweepReport.Trigger.MANUAL)).thenReturn(SweepReport.builder()
                .trigger(SweepReport.Trigger.MANUAL)
                .skipped(true)
                .build());

        mockMvc.perform(post("/api/v1/reverification/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.skipped").value(true));
    }

    @Test
    void getLastReport_found() throws Exception {
        when(scheduler.getLastReport()).thenReturn(SweepReport.builder()
                .trigger(SweepReport.Trigger.SCHEDULED)
                .errors(2)
                .build());

        mockMvc.perform(get("/api/v1/reverification/last"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trigger").value("SCHEDULED"))
                .andExpect(jsonPath("$.errors").value(2));
    }

    @Test
    void getLastReport_noneYet() throws Exception {
        when(scheduler.getLastReport()).thenReturn(null);

        mockMvc.perform(get("/api/v1/reverification/last"))
                .andExpect(status().isNotFound());
    }
}
