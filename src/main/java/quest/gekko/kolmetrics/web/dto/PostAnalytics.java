package quest.gekko.kolmetrics.web.dto;

import java.time.Instant;
import java.util.List;

public record PostAnalytics(PostInfo post,
                            String period,
                            Kpis currentKpis,
                            Deltas deltas,
                            List<Point> timeSeries,
                            int snapshotCount) {

    public record PostInfo(Long id, String content, String tweetUrl, Instant postedAt, String kolName,
                           String kolHandle, String campaignName) {}

    public record Kpis(long impressions, long likes, long retweets, long replies, long quotes, long bookmarks,
                       double engagementRate) {}

    /** Percent change against the last snapshot of the previous period. */
    public record Deltas(double impressions, double likes, double retweets, double replies, double engagementRate) {}

    public record Point(String date, long impressions, long likes, long retweets, long replies, long quotes,
                        long bookmarks, double engagementRate) {}
}
