package quest.gekko.kolmetrics.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.kolmetrics.domain.PostMetricSnapshot;
import quest.gekko.kolmetrics.service.analytics.AnalyticsPeriod;
import quest.gekko.kolmetrics.service.analytics.PostAnalyticsService;
import quest.gekko.kolmetrics.service.core.PostMetricsService;
import quest.gekko.kolmetrics.web.dto.PostAnalytics;
import quest.gekko.kolmetrics.web.dto.PostMetricsView;
import quest.gekko.kolmetrics.web.security.TenantSessionResolver;

import java.security.Principal;

@RestController
@RequestMapping("/api/posts/{postId}")
@RequiredArgsConstructor
public class PostMetricsController {
    private final PostMetricsService postMetricsService;
    private final PostAnalyticsService postAnalyticsService;
    private final TenantSessionResolver sessions;

    @PostMapping("/refresh-metrics")
    public PostMetricsView refresh(@PathVariable Long postId, Principal principal) {
        final PostMetricSnapshot snapshot =
                postMetricsService.refreshPost(sessions.requireAgency(principal).organizationId(), postId);
        return PostMetricsView.of(postId, snapshot);
    }

    @GetMapping("/analytics")
    public PostAnalytics analytics(@PathVariable Long postId,
                                   @RequestParam(required = false) String period,
                                   Principal principal) {
        final Long orgId = sessions.requireAgencyOrAdmin(principal).organizationId();
        return postAnalyticsService.analytics(orgId, postId, AnalyticsPeriod.parse(period, AnalyticsPeriod.D7));
    }
}
