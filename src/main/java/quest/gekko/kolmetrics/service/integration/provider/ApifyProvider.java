package quest.gekko.kolmetrics.service.integration.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.kolmetrics.service.credentials.CredentialContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Secondary provider backed by an actor-based scraper. It can only search, so a single
 * tweet is found by searching its author's timeline, and a profile comes from the author
 * block of the newest tweet.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApifyProvider implements TwitterDataProvider {
    private static final int SINGLE_TWEET_SEARCH_SIZE = 20;
    private static final int PROFILE_SEARCH_SIZE = 5;

    private final ApifyActorClient actor;
    private final ProviderResponseMapper mapper;

    @Override
    public ProviderKind kind() { return ProviderKind.APIFY; }

    @Override
    public boolean supportsProfiles() { return true; }

    @Override
    public boolean supportsSearch() { return true; }

    @Override
    public ProviderResult<ScrapedTweet> fetchTweet(final CredentialContext credentials, final TweetReference tweet) {
        if (!isConfigured(credentials)) return ProviderResult.unavailable(kind(), "no API key configured");
        if (!tweet.hasAuthorHandle()) {
            return ProviderResult.unavailable(kind(), "author handle unknown for tweet " + tweet.tweetId());
        }
        try {
            final List<JsonNode> items = actor.search(credentials.apifyApiKey(), "from:" + tweet.authorHandle(),
                    SINGLE_TWEET_SEARCH_SIZE);
            for (JsonNode item : items) {
                if (isPlaceholder(item) || !tweet.tweetId().equals(item.path("id").asText())) continue;
                final Optional<ScrapedTweet> mapped = mapper.toTweet(kind(), item, tweet.tweetId());
                if (mapped.isPresent()) return ProviderResult.ok(kind(), mapped.get());
            }
            return ProviderResult.unavailable(kind(), "tweet " + tweet.tweetId() + " not among recent tweets of @"
                    + tweet.authorHandle());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProviderResult.unavailable(kind(), "interrupted");
        } catch (RuntimeException e) {
            return failed("tweet " + tweet.tweetId(), e);
        }
    }

    @Override
    public ProviderResult<ScrapedProfile> fetchProfile(final CredentialContext credentials, final String handle) {
        if (!isConfigured(credentials)) return ProviderResult.unavailable(kind(), "no API key configured");
        try {
            for (JsonNode item : actor.search(credentials.apifyApiKey(), "from:" + handle, PROFILE_SEARCH_SIZE)) {
                if (isPlaceholder(item)) continue;
                final JsonNode author = item.path("author");
                if (author.isObject()) return ProviderResult.ok(kind(), mapper.toProfile(kind(), author, handle));
            }
            return ProviderResult.unavailable(kind(), "no tweets with author data for @" + handle);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProviderResult.unavailable(kind(), "interrupted");
        } catch (RuntimeException e) {
            return failed("profile @" + handle, e);
        }
    }

    @Override
    public ProviderResult<List<ScrapedTweet>> searchRecent(final CredentialContext credentials, final String handle,
                                                           final int maxTweets) {
        if (!isConfigured(credentials)) return ProviderResult.unavailable(kind(), "no API key configured");
        try {
            final List<JsonNode> items = actor.search(credentials.apifyApiKey(), "from:" + handle, maxTweets);
            final List<ScrapedTweet> tweets = new ArrayList<>();
            for (JsonNode item : items) {
                if (isPlaceholder(item)) continue;
                final String content = item.path("text").asText(item.path("full_text").asText(""));
                if (mapper.isRetweetOrForeignReply(kind(), item, content, handle)) continue;
                mapper.toTweet(kind(), item, null).ifPresent(tweets::add);
                if (tweets.size() >= maxTweets) break;
            }
            if (tweets.isEmpty() && !items.isEmpty()) {
                return ProviderResult.unavailable(kind(), "no tweets found for @" + handle);
            }
            return ProviderResult.ok(kind(), tweets);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProviderResult.unavailable(kind(), "interrupted");
        } catch (RuntimeException e) {
            return failed("search @" + handle, e);
        }
    }

    /** The actor answers empty searches with a canned "mock data" item. */
    static boolean isPlaceholder(final JsonNode item) {
        if ("mock_tweet".equals(item.path("type").asText())) return true;
        final String id = item.path("id").asText("");
        if (id.isEmpty() || "-1".equals(id)) return true;
        final String content = item.path("text").asText(item.path("full_text").asText(""));
        return content.contains("KaitoEasyAPI") && content.contains("mock data");
    }

    private <T> ProviderResult<T> failed(final String what, final RuntimeException e) {
        final String reason = ProviderErrors.describe(e);
        log.warn("Apify {} unavailable: {}", what, reason);
        return ProviderResult.unavailable(kind(), reason);
    }
}
