package quest.gekko.kolmetrics.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.kolmetrics.service.core.MetricsRefreshService;
import quest.gekko.kolmetrics.service.core.RefreshSummary;
import quest.gekko.kolmetrics.web.security.CronSecretVerifier;

@RestController
@RequestMapping("/api/cron")
@RequiredArgsConstructor
public class CronController {
    private final CronSecretVerifier secretVerifier;
    private final MetricsRefreshService refreshService;

    @PostMapping("/refresh-metrics")
    public RefreshSummary refreshMetrics(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        secretVerifier.verify(authorization);
        return refreshService.runScheduledRefresh();
    }
}
