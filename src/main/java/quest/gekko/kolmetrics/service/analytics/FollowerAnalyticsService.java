package quest.gekko.kolmetrics.service.analytics;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.kolmetrics.domain.Kol;
import quest.gekko.kolmetrics.domain.KolFollowerSnapshot;
import quest.gekko.kolmetrics.repository.KolFollowerSnapshotRepository;
import quest.gekko.kolmetrics.repository.KolRepository;
import quest.gekko.kolmetrics.web.dto.FollowerAnalytics;
import quest.gekko.kolmetrics.web.dto.KolSummary;
import quest.gekko.kolmetrics.web.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
public class FollowerAnalyticsService {
    private final KolRepository kolRepository;
    private final KolFollowerSnapshotRepository snapshotRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public FollowerAnalytics analytics(final Long organizationId, final Long kolId, final AnalyticsPeriod period) {
        final Kol kol = kolRepository.findByIdAndOrganizationId(kolId, organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("KOL not found"));

        final Instant now = clock.instant();
        final Instant periodStart = now.minus(period.length());
        final Instant previousStart = periodStart.minus(period.length());

        final List<KolFollowerSnapshot> current =
                snapshotRepository.findByKolIdAndCapturedAtBetweenOrderByCapturedAtAsc(kolId, periodStart, now);
        final List<KolFollowerSnapshot> previous = snapshotRepository
                .findByKolIdAndCapturedAtGreaterThanEqualAndCapturedAtLessThanOrderByCapturedAtAsc(kolId, previousStart, periodStart);

        final KolFollowerSnapshot latest = current.isEmpty() ? null : current.get(current.size() - 1);
        final KolFollowerSnapshot earliest = current.isEmpty() ? null : current.get(0);
        final long currentFollowers = latest != null ? latest.getFollowersCount() : orZero(kol.getFollowersCount());
        final long followingCount = latest != null ? orZero(latest.getFollowingCount()) : orZero(kol.getFollowingCount());
        final long startFollowers = earliest != null ? earliest.getFollowersCount() : currentFollowers;

        long gained = 0;
        long lost = 0;
        for (KolFollowerSnapshot s : current) {
            final long change = orZero(s.getFollowersChange());
            if (change > 0) gained += change;
            else lost += -change;
        }
        final Long previousChange = previous.isEmpty() ? null
                : previous.get(previous.size() - 1).getFollowersCount() - previous.get(0).getFollowersCount();

        final List<FollowerAnalytics.Point> series = DailySeries.lastPerDay(current, KolFollowerSnapshot::getCapturedAt,
                (day, s) -> new FollowerAnalytics.Point(day, s.getFollowersCount(), orZero(s.getFollowingCount()),
                        orZero(s.getFollowersChange())));

        return new FollowerAnalytics(
                new KolSummary(kol.getId(), kol.getName(), kol.getTwitterHandle()),
                period.key(),
                new FollowerAnalytics.Summary(currentFollowers, followingCount, currentFollowers - startFollowers,
                        gained, lost, previousChange),
                series,
                current.size());
    }

    private static long orZero(final Long value) {
        return value == null ? 0L : value;
    }
}
