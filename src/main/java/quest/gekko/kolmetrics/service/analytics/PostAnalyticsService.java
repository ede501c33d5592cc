package quest.gekko.kolmetrics.service.analytics;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.kolmetrics.domain.Post;
import quest.gekko.kolmetrics.domain.PostMetricSnapshot;
import quest.gekko.kolmetrics.repository.PostMetricSnapshotRepository;
import quest.gekko.kolmetrics.repository.PostRepository;
import quest.gekko.kolmetrics.web.dto.PostAnalytics;
import quest.gekko.kolmetrics.web.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static quest.gekko.kolmetrics.util.EngagementMath.percentChange;

@Service
@RequiredArgsConstructor
public class PostAnalyticsService {
    private final PostRepository postRepository;
    private final PostMetricSnapshotRepository snapshotRepository;
    private final Clock clock;

    /**
     * KPIs come from the newest snapshot in the period, or from the post's current columns when
     * the period has none. Deltas are null when the previous period has no snapshot.
     */
    @Transactional(readOnly = true)
    public PostAnalytics analytics(final Long organizationId, final Long postId, final AnalyticsPeriod period) {
        final Post post = postRepository.findByIdAndCampaignAgencyId(postId, organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("Post not found"));

        final Instant now = clock.instant();
        final Instant periodStart = now.minus(period.length());
        final Instant previousStart = periodStart.minus(period.length());

        final List<PostMetricSnapshot> current =
                snapshotRepository.findByPostIdAndCapturedAtBetweenOrderByCapturedAtAsc(postId, periodStart, now);
        final List<PostMetricSnapshot> previous = snapshotRepository
                .findByPostIdAndCapturedAtGreaterThanEqualAndCapturedAtLessThanOrderByCapturedAtAsc(postId, previousStart, periodStart);

        final PostAnalytics.Kpis kpis = current.isEmpty() ? kpisOf(post) : kpisOf(current.get(current.size() - 1));
        final PostAnalytics.Deltas deltas = previous.isEmpty() ? null
                : deltas(kpis, kpisOf(previous.get(previous.size() - 1)));

        final List<PostAnalytics.Point> series = DailySeries.lastPerDay(current, PostMetricSnapshot::getCapturedAt,
                (day, s) -> new PostAnalytics.Point(day, orZero(s.getImpressions()), orZero(s.getLikes()),
                        orZero(s.getRetweets()), orZero(s.getReplies()), orZero(s.getQuotes()),
                        orZero(s.getBookmarks()), orZero(s.getEngagementRate())));

        final PostAnalytics.PostInfo info = new PostAnalytics.PostInfo(post.getId(), post.getContent(), post.getTweetUrl(),
                post.getPostedAt(), post.getKol().getName(), post.getKol().getTwitterHandle(), post.getCampaign().getName());
        return new PostAnalytics(info, period.key(), kpis, deltas, series, current.size());
    }

    static PostAnalytics.Deltas deltas(final PostAnalytics.Kpis now, final PostAnalytics.Kpis before) {
        return new PostAnalytics.Deltas(
                percentChange(now.impressions(), before.impressions()),
                percentChange(now.likes(), before.likes()),
                percentChange(now.retweets(), before.retweets()),
                percentChange(now.replies(), before.replies()),
                percentChange(now.engagementRate(), before.engagementRate()));
    }

    private static PostAnalytics.Kpis kpisOf(final PostMetricSnapshot s) {
        return new PostAnalytics.Kpis(orZero(s.getImpressions()), orZero(s.getLikes()), orZero(s.getRetweets()),
                orZero(s.getReplies()), orZero(s.getQuotes()), orZero(s.getBookmarks()), orZero(s.getEngagementRate()));
    }

    private static PostAnalytics.Kpis kpisOf(final Post p) {
        return new PostAnalytics.Kpis(orZero(p.getImpressions()), orZero(p.getLikes()), orZero(p.getRetweets()),
                orZero(p.getReplies()), orZero(p.getQuotes()), orZero(p.getBookmarks()), orZero(p.getEngagementRate()));
    }

    private static long orZero(final Long value) {
        return value == null ? 0L : value;
    }

    private static double orZero(final Double value) {
        return value == null ? 0.0 : value;
    }
}
