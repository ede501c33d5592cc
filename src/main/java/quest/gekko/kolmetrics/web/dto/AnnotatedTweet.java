package quest.gekko.kolmetrics.web.dto;

import quest.gekko.kolmetrics.service.integration.provider.ScrapedTweet;
import quest.gekko.kolmetrics.service.integration.provider.TweetMetrics;

import java.time.Instant;
import java.util.List;

/** A scraped tweet with the campaign KOL it belongs to and its keyword hits. */
public record AnnotatedTweet(String id,
                             String url,
                             String content,
                             String authorHandle,
                             String authorName,
                             Instant postedAt,
                             boolean isRetweet,
                             boolean isQuote,
                             TweetMetrics metrics,
                             List<String> mediaUrls,
                             Long kolId,
                             String kolName,
                             List<String> matchedKeywords,
                             boolean hasKeywordMatch) {

    public static AnnotatedTweet of(final ScrapedTweet t, final KolSummary kol, final List<String> matchedKeywords) {
        return new AnnotatedTweet(t.id(), t.url(), t.content(), t.authorHandle(), t.authorName(), t.postedAt(),
                t.retweet(), t.quote(), t.metrics(), t.mediaUrls(),
                kol == null ? null : kol.id(), kol == null ? null : kol.name(),
                matchedKeywords, !matchedKeywords.isEmpty());
    }
}
