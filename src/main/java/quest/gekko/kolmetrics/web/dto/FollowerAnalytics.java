package quest.gekko.kolmetrics.web.dto;

import java.util.List;

public record FollowerAnalytics(KolSummary kol,
                                String period,
                                Summary summary,
                                List<Point> timeSeries,
                                int snapshotCount) {

    /** {@code previousPeriodChange} is null when the previous period has no snapshots. */
    public record Summary(long currentFollowers,
                          long followingCount,
                          long netChange,
                          long totalGained,
                          long totalLost,
                          Long previousPeriodChange) {}

    public record Point(String date, long followersCount, long followingCount, long followersChange) {}
}
