package quest.gekko.kolmetrics.service.integration.provider;

import java.time.Instant;
import java.util.List;

public record ScrapedTweet(String id,
                           String url,
                           String content,
                           String authorHandle,
                           String authorName,
                           Instant postedAt,
                           boolean retweet,
                           boolean quote,
                           TweetMetrics metrics,
                           List<String> mediaUrls) {
}
