package quest.gekko.kolmetrics.repository;

/** Averages over a KOL's posts; every average is null when {@code postCount} is 0. */
public record PostAverages(Double likes, Double retweets, Double replies, Double impressions, Long postCount) {
}
