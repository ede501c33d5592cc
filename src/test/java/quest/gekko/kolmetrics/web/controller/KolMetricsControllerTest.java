package quest.gekko.kolmetrics.web.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import quest.gekko.kolmetrics.domain.OrganizationType;
import quest.gekko.kolmetrics.service.analytics.AnalyticsPeriod;
import quest.gekko.kolmetrics.service.analytics.FollowerAnalyticsService;
import quest.gekko.kolmetrics.service.core.KolMetricsService;
import quest.gekko.kolmetrics.web.exception.GlobalExceptionHandler;
import quest.gekko.kolmetrics.web.security.TenantSession;
import quest.gekko.kolmetrics.web.security.TenantSessionResolver;

import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class KolMetricsControllerTest {

    private static final TenantSession AGENCY = new TenantSession(10L, OrganizationType.AGENCY, false, "ana");
    private static final TenantSession CLIENT_ADMIN = new TenantSession(20L, OrganizationType.CLIENT, true, "root");

    @Mock
    private KolMetricsService kolMetricsService;

    @Mock
    private FollowerAnalyticsService followerAnalyticsService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        KolMetricsController controller =
                new KolMetricsController(kolMetricsService, followerAnalyticsService, new TenantSessionResolver());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void refreshAll_reportsCounts() throws Exception {
        when(kolMetricsService.refreshAll(10L)).thenReturn(new KolMetricsService.RefreshAllResult(2, 1, 1, List.of()));

        mockMvc.perform(post("/api/kols/refresh-metrics").principal(AGENCY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.updated").value(1))
                .andExpect(jsonPath("$.failed").value(1));
    }

    @Test
    void followerAnalytics_defaultsToThirtyDays() throws Exception {
        mockMvc.perform(get("/api/kols/3/followers/analytics").principal(AGENCY))
                .andExpect(status().isOk());

        verify(followerAnalyticsService).analytics(10L, 3L, AnalyticsPeriod.D30);
    }

    @Test
    void followerAnalytics_isHiddenFromClientAdmins() throws Exception {
        mockMvc.perform(get("/api/kols/3/followers/analytics").param("period", "90d").principal(CLIENT_ADMIN))
                .andExpect(status().isForbidden());

        verifyNoInteractions(followerAnalyticsService);
    }
}
