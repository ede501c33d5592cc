package quest.gekko.kolmetrics.service.integration.provider;

/** Missing counters are normalized to 0. {@code views} is what posts store as impressions. */
public record TweetMetrics(long views, long likes, long retweets, long replies, long quotes, long bookmarks) {
    public static final TweetMetrics EMPTY = new TweetMetrics(0, 0, 0, 0, 0, 0);
}
