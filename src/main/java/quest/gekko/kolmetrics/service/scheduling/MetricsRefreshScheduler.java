package quest.gekko.kolmetrics.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.kolmetrics.config.KolProperties;
import quest.gekko.kolmetrics.service.core.MetricsRefreshService;
import quest.gekko.kolmetrics.service.core.RefreshSummary;

/** In-process alternative to the external cron trigger; off unless {@code kol.refresh.schedule-enabled}. */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsRefreshScheduler {
    private final MetricsRefreshService refreshService;
    private final KolProperties.Refresh refresh;

    @Scheduled(cron = "${kol.refresh.cron:0 0 */6 * * *}", zone = "UTC")
    public void runScheduledRefresh() {
        if (!refresh.scheduleEnabled()) return;
        final RefreshSummary summary = refreshService.runScheduledRefresh();
        log.info("Scheduled refresh {}: posts {}/{}, kols {}/{}", summary.status(),
                summary.posts().success(), summary.posts().total(),
                summary.kols().success(), summary.kols().total());
    }
}
