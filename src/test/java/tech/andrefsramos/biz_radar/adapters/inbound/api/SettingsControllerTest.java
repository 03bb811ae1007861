package tech.andrefsramos.biz_radar.adapters.inbound.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;
import tech.andrefsramos.biz_radar.config.SecurityConfig;
import tech.andrefsramos.biz_radar.core.application.MonitoringSettingsUseCase;
import tech.andrefsramos.biz_radar.core.domain.MonitoringConfig;
import tech.andrefsramos.biz_radar.core.exception.InvalidSettingsException;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static tech.andrefsramos.biz_radar.support.Fixtures.config;

@WebMvcTest(SettingsController.class)
@Import(SecurityConfig.class)
@DisplayName("SettingsController")
class SettingsControllerTest {

    private static final String BODY = """
            {
              "businessName": "Padaria Central",
              "latitude": -23.55,
              "longitude": -46.63,
              "radiusMeters": 20,
              "scanIntervalMinutes": 60,
              "includeCategories": ["DINING_DRINKING"],
              "excludeCategories": [],
              "minRating": null,
              "notifyNewBusinesses": true,
              "notifyRatingChanges": true,
              "notifyTrending": true,
              "notifyRemovals": true,
              "notifySystemStatus": true,
              "status": "ACTIVE"
            }
            """;

    @Autowired
    private MockMvc mvc;

    @MockBean
    private MonitoringSettingsUseCase settings;

    @Test
    @DisplayName("Current settings are public")
    void current() throws Exception {
        when(settings.current()).thenReturn(config());

        mvc.perform(get("/api/v1/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.radiusMeters").value(1000))
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    @DisplayName("Updating settings requires operator credentials")
    void updateNeedsAuth() throws Exception {
        mvc.perform(put("/api/v1/settings").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @WithMockUser(roles = "OPERATOR")
    @DisplayName("Rejected settings answer 400 with every validation error")
    void rejected() throws Exception {
        when(settings.update(any(MonitoringConfig.class)))
                .thenThrow(new InvalidSettingsException(List.of("radiusMeters must be within [100, 5000]")));

        mvc.perform(put("/api/v1/settings").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_SETTINGS"))
                .andExpect(jsonPath("$.details[0]").value("radiusMeters must be within [100, 5000]"));
    }

    @Test
    @WithMockUser(roles = "OPERATOR")
    @DisplayName("Accepted settings are echoed back")
    void accepted() throws Exception {
        when(settings.update(any(MonitoringConfig.class))).thenReturn(config());

        mvc.perform(put("/api/v1/settings").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.businessName").value("Padaria Central"));
    }
}
