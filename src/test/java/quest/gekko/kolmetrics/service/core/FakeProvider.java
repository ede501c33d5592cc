package quest.gekko.kolmetrics.service.core;

import quest.gekko.kolmetrics.service.credentials.CredentialContext;
import quest.gekko.kolmetrics.service.integration.provider.ProviderKind;
import quest.gekko.kolmetrics.service.integration.provider.ProviderResult;
import quest.gekko.kolmetrics.service.integration.provider.ScrapedProfile;
import quest.gekko.kolmetrics.service.integration.provider.ScrapedTweet;
import quest.gekko.kolmetrics.service.integration.provider.TweetMetrics;
import quest.gekko.kolmetrics.service.integration.provider.TweetReference;
import quest.gekko.kolmetrics.service.integration.provider.TwitterDataProvider;

import java.time.Instant;
import java.util.List;

/** In-memory provider with canned answers and call counters. */
class FakeProvider implements TwitterDataProvider {
    private final ProviderKind kind;
    ProviderResult<ScrapedTweet> tweet;
    ProviderResult<ScrapedProfile> profile;
    ProviderResult<List<ScrapedTweet>> search;
    int tweetCalls;
    int profileCalls;
    int searchCalls;

    FakeProvider(ProviderKind kind) {
        this.kind = kind;
        this.tweet = ProviderResult.unavailable(kind, kind + " down");
        this.profile = ProviderResult.unavailable(kind, kind + " down");
        this.search = ProviderResult.unavailable(kind, kind + " down");
    }

    static ScrapedTweet tweet(String id, String handle, String content) {
        return new ScrapedTweet(id, "https://x.com/" + handle + "/status/" + id, content, handle, handle,
                Instant.parse("2024-05-01T00:00:00Z"), false, false, new TweetMetrics(1000, 50, 5, 5, 0, 1), List.of());
    }

    @Override
    public ProviderKind kind() { return kind; }

    @Override
    public boolean supportsProfiles() { return kind != ProviderKind.SYNDICATION; }

    @Override
    public boolean supportsSearch() { return kind != ProviderKind.SYNDICATION; }

    @Override
    public ProviderResult<ScrapedTweet> fetchTweet(CredentialContext credentials, TweetReference ref) {
        tweetCalls++;
        return tweet;
    }

    @Override
    public ProviderResult<ScrapedProfile> fetchProfile(CredentialContext credentials, String handle) {
        profileCalls++;
        return profile;
    }

    @Override
    public ProviderResult<List<ScrapedTweet>> searchRecent(CredentialContext credentials, String handle, int maxTweets) {
        searchCalls++;
        return search;
    }
}
