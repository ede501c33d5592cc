package quest.gekko.kolmetrics.web.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import quest.gekko.kolmetrics.domain.OrganizationType;
import quest.gekko.kolmetrics.domain.PostMetricSnapshot;
import quest.gekko.kolmetrics.service.analytics.AnalyticsPeriod;
import quest.gekko.kolmetrics.service.analytics.PostAnalyticsService;
import quest.gekko.kolmetrics.service.core.PostMetricsService;
import quest.gekko.kolmetrics.service.core.ProviderUnavailableException;
import quest.gekko.kolmetrics.web.exception.CooldownActiveException;
import quest.gekko.kolmetrics.web.exception.GlobalExceptionHandler;
import quest.gekko.kolmetrics.web.exception.ResourceNotFoundException;
import quest.gekko.kolmetrics.web.security.TenantSession;
import quest.gekko.kolmetrics.web.security.TenantSessionResolver;

import java.time.Instant;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class PostMetricsControllerTest {

    private static final TenantSession AGENCY = new TenantSession(10L, OrganizationType.AGENCY, false, "ana");
    private static final TenantSession CLIENT = new TenantSession(20L, OrganizationType.CLIENT, false, "cleo");

    @Mock
    private PostMetricsService postMetricsService;

    @Mock
    private PostAnalyticsService postAnalyticsService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        PostMetricsController controller =
                new PostMetricsController(postMetricsService, postAnalyticsService, new TenantSessionResolver());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void refresh_returnsFreshMetrics() throws Exception {
        PostMetricSnapshot snapshot = new PostMetricSnapshot();
        snapshot.setImpressions(1000L);
        snapshot.setLikes(50L);
        snapshot.setRetweets(5L);
        snapshot.setReplies(5L);
        snapshot.setQuotes(0L);
        snapshot.setBookmarks(1L);
        snapshot.setEngagementRate(6.0);
        snapshot.setCapturedAt(Instant.parse("2024-06-30T12:00:00Z"));
        when(postMetricsService.refreshPost(10L, 5L)).thenReturn(snapshot);

        mockMvc.perform(post("/api/posts/5/refresh-metrics").principal(AGENCY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.postId").value(5))
                .andExpect(jsonPath("$.impressions").value(1000))
                .andExpect(jsonPath("$.engagementRate").value(6.0));
    }

    @Test
    void refresh_clientOrganizationIsForbidden() throws Exception {
        mockMvc.perform(post("/api/posts/5/refresh-metrics").principal(CLIENT))
                .andExpect(status().isForbidden());

        verifyNoInteractions(postMetricsService);
    }

    @Test
    void refresh_withoutSessionIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/posts/5/refresh-metrics"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void refresh_cooldownIsTooManyRequests() throws Exception {
        when(postMetricsService.refreshPost(10L, 5L)).thenThrow(new CooldownActiveException(40));

        mockMvc.perform(post("/api/posts/5/refresh-metrics").principal(AGENCY))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.minutesRemaining").value(40));
    }

    @Test
    void refresh_unknownPostIsNotFound() throws Exception {
        when(postMetricsService.refreshPost(10L, 5L)).thenThrow(new ResourceNotFoundException("Post not found"));

        mockMvc.perform(post("/api/posts/5/refresh-metrics").principal(AGENCY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Post not found"));
    }

    @Test
    void refresh_allProvidersFailingIsBadGateway() throws Exception {
        when(postMetricsService.refreshPost(10L, 5L))
                .thenThrow(new ProviderUnavailableException("all providers failed"));

        mockMvc.perform(post("/api/posts/5/refresh-metrics").principal(AGENCY))
                .andExpect(status().isBadGateway());
    }

    @Test
    void analytics_unknownPeriodFallsBackToSevenDays() throws Exception {
        mockMvc.perform(get("/api/posts/5/analytics").param("period", "2y").principal(AGENCY))
                .andExpect(status().isOk());

        verify(postAnalyticsService).analytics(10L, 5L, AnalyticsPeriod.D7);
    }
}
