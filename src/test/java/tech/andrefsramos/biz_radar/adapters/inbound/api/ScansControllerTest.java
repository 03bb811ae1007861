package tech.andrefsramos.biz_radar.adapters.inbound.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;
import tech.andrefsramos.biz_radar.config.SecurityConfig;
import tech.andrefsramos.biz_radar.core.application.ScanSchedulerUseCase;
import tech.andrefsramos.biz_radar.core.domain.MonitoringStatus;
import tech.andrefsramos.biz_radar.core.domain.ScanOutcome;
import tech.andrefsramos.biz_radar.core.domain.ScanRecord;
import tech.andrefsramos.biz_radar.core.domain.ScanState;
import tech.andrefsramos.biz_radar.core.domain.ScanStatus;
import tech.andrefsramos.biz_radar.core.exception.ScanInProgressException;

import java.util.List;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static tech.andrefsramos.biz_radar.support.Fixtures.T0;

@WebMvcTest(ScansController.class)
@Import(SecurityConfig.class)
@DisplayName("ScansController")
class ScansControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ScanSchedulerUseCase scheduler;

    private static ScanRecord success() {
        return ScanRecord.running(T0).complete(T0.plusSeconds(3), ScanOutcome.SUCCESS, 12, 2, 1, 0, null, null)
                .withId(5L);
    }

    @Test
    @DisplayName("History and status are public")
    void readEndpoints() throws Exception {
        when(scheduler.history(3)).thenReturn(List.of(success()));
        when(scheduler.status()).thenReturn(new ScanStatus(ScanState.IDLE, null, false, success(),
                T0.plusSeconds(3600), MonitoringStatus.ACTIVE));

        mvc.perform(get("/api/v1/scans").param("limit", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(5))
                .andExpect(jsonPath("$[0].outcome").value("SUCCESS"))
                .andExpect(jsonPath("$[0].fetchedCount").value(12));
        mvc.perform(get("/api/v1/scans/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("IDLE"))
                .andExpect(jsonPath("$.nextScanDueAt").value("2026-03-02T11:00:00Z"));
    }

    @Test
    @DisplayName("Manual trigger requires operator credentials")
    void triggerNeedsAuth() throws Exception {
        mvc.perform(post("/api/v1/scans")).andExpect(status().isUnauthorized());
        mvc.perform(post("/api/v1/scans/cancel")).andExpect(status().isUnauthorized());

        verifyNoInteractions(scheduler);
    }

    @Test
    @DisplayName("Manual trigger returns the finalized record")
    void trigger() throws Exception {
        when(scheduler.triggerScan()).thenReturn(success());

        mvc.perform(post("/api/v1/scans").with(httpBasic("operator", "secret")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("SUCCESS"))
                .andExpect(jsonPath("$.newCount").value(2));
    }

    @Test
    @WithMockUser(roles = "OPERATOR")
    @DisplayName("Trigger during a running scan answers 409")
    void triggerWhileRunning() throws Exception {
        when(scheduler.triggerScan()).thenThrow(new ScanInProgressException(T0));

        mvc.perform(post("/api/v1/scans"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("SCAN_IN_PROGRESS"));
    }

    @Test
    @WithMockUser(roles = "OPERATOR")
    @DisplayName("Cancel answers 202 when a scan is running and 409 otherwise")
    void cancel() throws Exception {
        when(scheduler.cancel()).thenReturn(true, false);

        mvc.perform(post("/api/v1/scans/cancel")).andExpect(status().isAccepted());
        mvc.perform(post("/api/v1/scans/cancel")).andExpect(status().isConflict());
    }
}
