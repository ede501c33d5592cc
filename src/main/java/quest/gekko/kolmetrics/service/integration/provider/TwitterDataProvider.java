package quest.gekko.kolmetrics.service.integration.provider;

import quest.gekko.kolmetrics.service.credentials.CredentialContext;

import java.util.List;

/**
 * One external source of tweet and profile data. Implementations never throw: any network,
 * status or payload problem comes back as {@link ProviderResult#unavailable}.
 */
public interface TwitterDataProvider {
    ProviderKind kind();

    default boolean isConfigured(CredentialContext credentials) {
        return credentials.isConfigured(kind());
    }

    ProviderResult<ScrapedTweet> fetchTweet(CredentialContext credentials, TweetReference tweet);

    default boolean supportsProfiles() { return false; }

    default ProviderResult<ScrapedProfile> fetchProfile(CredentialContext credentials, String handle) {
        return ProviderResult.unavailable(kind(), "profiles not supported");
    }

    default boolean supportsSearch() { return false; }

    /** Recent original tweets by {@code handle}, newest first, at most {@code maxTweets}. */
    default ProviderResult<List<ScrapedTweet>> searchRecent(CredentialContext credentials, String handle, int maxTweets) {
        return ProviderResult.unavailable(kind(), "search not supported");
    }
}
