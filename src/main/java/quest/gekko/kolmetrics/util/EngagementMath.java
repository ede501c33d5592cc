package quest.gekko.kolmetrics.util;

public final class EngagementMath {
    private EngagementMath() {}

    /** Interactions as a percentage of impressions, two decimals; 0 when there are no impressions. */
    public static double engagementRate(final long likes, final long retweets, final long replies, final long quotes,
                                        final long impressions) {
        if (impressions <= 0) return 0.0;
        return round2((double) (likes + retweets + replies + quotes) / impressions * 100);
    }

    public static double round2(final double value) {
        return Math.round(value * 100) / 100.0;
    }

    public static double round1(final double value) {
        return Math.round(value * 10) / 10.0;
    }

    /** Percentage change; a rise from zero counts as 100%. */
    public static double percentChange(final double current, final double previous) {
        if (previous == 0) return current > 0 ? 100.0 : 0.0;
        return round1((current - previous) / previous * 100);
    }
}
