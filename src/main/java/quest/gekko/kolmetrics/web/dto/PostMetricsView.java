package quest.gekko.kolmetrics.web.dto;

import quest.gekko.kolmetrics.domain.PostMetricSnapshot;

import java.time.Instant;

public record PostMetricsView(Long postId,
                              long impressions,
                              long likes,
                              long retweets,
                              long replies,
                              long quotes,
                              long bookmarks,
                              double engagementRate,
                              Instant lastMetricsUpdate) {

    public static PostMetricsView of(final Long postId, final PostMetricSnapshot s) {
        return new PostMetricsView(postId, s.getImpressions(), s.getLikes(), s.getRetweets(), s.getReplies(),
                s.getQuotes(), s.getBookmarks(), s.getEngagementRate(), s.getCapturedAt());
    }
}
