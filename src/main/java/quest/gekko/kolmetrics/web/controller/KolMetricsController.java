package quest.gekko.kolmetrics.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.kolmetrics.service.analytics.AnalyticsPeriod;
import quest.gekko.kolmetrics.service.analytics.FollowerAnalyticsService;
import quest.gekko.kolmetrics.service.core.KolMetricsService;
import quest.gekko.kolmetrics.service.core.KolRefreshOutcome;
import quest.gekko.kolmetrics.web.dto.FollowerAnalytics;
import quest.gekko.kolmetrics.web.security.TenantSessionResolver;

import java.security.Principal;

@RestController
@RequestMapping("/api/kols")
@RequiredArgsConstructor
public class KolMetricsController {
    private final KolMetricsService kolMetricsService;
    private final FollowerAnalyticsService followerAnalyticsService;
    private final TenantSessionResolver sessions;

    @PostMapping("/{kolId}/metrics")
    public KolRefreshOutcome refreshKol(@PathVariable Long kolId, Principal principal) {
        return kolMetricsService.refreshKol(sessions.requireAgency(principal).organizationId(), kolId);
    }

    @PostMapping("/refresh-metrics")
    public KolMetricsService.RefreshAllResult refreshAll(Principal principal) {
        return kolMetricsService.refreshAll(sessions.requireAgency(principal).organizationId());
    }

    // follower history is agency-confidential, clients never see it
    @GetMapping("/{kolId}/followers/analytics")
    public FollowerAnalytics followerAnalytics(@PathVariable Long kolId,
                                               @RequestParam(required = false) String period,
                                               Principal principal) {
        final Long orgId = sessions.requireAgency(principal).organizationId();
        return followerAnalyticsService.analytics(orgId, kolId, AnalyticsPeriod.parse(period, AnalyticsPeriod.D30));
    }
}
