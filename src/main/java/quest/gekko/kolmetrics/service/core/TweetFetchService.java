package quest.gekko.kolmetrics.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import quest.gekko.kolmetrics.config.CacheConfig;
import quest.gekko.kolmetrics.config.KolProperties;
import quest.gekko.kolmetrics.service.credentials.CredentialContext;
import quest.gekko.kolmetrics.service.integration.provider.ProfileMedia;
import quest.gekko.kolmetrics.service.integration.provider.ProviderChain;
import quest.gekko.kolmetrics.service.integration.provider.ProviderKind;
import quest.gekko.kolmetrics.service.integration.provider.ProviderResult;
import quest.gekko.kolmetrics.service.integration.provider.ScrapedProfile;
import quest.gekko.kolmetrics.service.integration.provider.ScrapedTweet;
import quest.gekko.kolmetrics.service.integration.provider.TweetReference;
import quest.gekko.kolmetrics.service.integration.provider.TwitterDataProvider;
import quest.gekko.kolmetrics.util.Pacer;
import quest.gekko.kolmetrics.util.TweetIdentifiers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Single-item lookups across the provider chain. Each call walks the providers in precedence
 * order, skipping unconfigured ones, and returns the first successful result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TweetFetchService {
    private final ProviderChain chain;
    private final Pacer pacer;
    private final KolProperties.Scrape scrape;

    /**
     * @throws quest.gekko.kolmetrics.util.MalformedTweetIdentifierException if the input is
     *         neither a tweet id nor a status URL
     */
    public ProviderResult<ScrapedTweet> fetchTweet(final CredentialContext credentials, final String idOrUrl) {
        return fetchTweet(credentials, TweetIdentifiers.require(idOrUrl));
    }

    public ProviderResult<ScrapedTweet> fetchTweet(final CredentialContext credentials, final TweetReference tweet) {
        return firstOk(chain.all(), credentials, "tweet " + tweet.tweetId(), p -> p.fetchTweet(credentials, tweet));
    }

    public ProviderResult<ScrapedProfile> fetchProfile(final CredentialContext credentials, final String handle) {
        final String clean = TweetIdentifiers.cleanHandle(handle);
        return firstOk(chain.profileCapable(), credentials, "profile @" + clean,
                p -> withFollowers(p.fetchProfile(credentials, clean), clean));
    }

    /**
     * The primary API answers unknown or suspended accounts with an empty profile, so a zero
     * follower count from it is not trusted for metrics. Media lookups still accept it.
     */
    static ProviderResult<ScrapedProfile> withFollowers(final ProviderResult<ScrapedProfile> result, final String handle) {
        if (result.isOk() && result.provider() == ProviderKind.SOCIALDATA && result.value().followersCount() == 0) {
            return ProviderResult.unavailable(ProviderKind.SOCIALDATA, "profile @" + handle + " reported 0 followers");
        }
        return result;
    }

    /** The first provider returning an avatar or a banner wins. Empty results are not cached. */
    @Cacheable(cacheNames = CacheConfig.PROFILE_MEDIA,
            key = "T(quest.gekko.kolmetrics.util.TweetIdentifiers).cleanHandle(#handle).toLowerCase()",
            unless = "#result.isEmpty()")
    public ProfileMedia fetchAvatarAndBanner(final CredentialContext credentials, final String handle) {
        final String clean = TweetIdentifiers.cleanHandle(handle);
        for (TwitterDataProvider provider : chain.profileCapable()) {
            if (!provider.isConfigured(credentials)) continue;
            final ProviderResult<ScrapedProfile> result = provider.fetchProfile(credentials, clean);
            if (!result.isOk()) continue;
            final ProfileMedia media = new ProfileMedia(result.value().avatarUrl(), result.value().bannerUrl());
            if (!media.isEmpty()) {
                log.debug("{} served media for @{}", provider.kind(), clean);
                return media;
            }
        }
        return ProfileMedia.NONE;
    }

    /**
     * Recent tweets of one KOL. With keywords, only tweets containing at least one of them
     * (case-insensitive) count, and a provider whose tweets all miss falls through to the next.
     */
    public KolSearchResult searchKol(final CredentialContext credentials, final String handle,
                                     final List<String> keywords, final int maxTweets) {
        final String clean = TweetIdentifiers.cleanHandle(handle);
        if (!credentials.hasAnyProviderConfigured()) {
            return KolSearchResult.failed(clean, "No API key configured");
        }
        final List<String> lowered = keywords == null ? List.of()
                : keywords.stream().filter(k -> k != null && !k.isBlank()).map(k -> k.toLowerCase(Locale.ROOT)).toList();

        String lastError = "No API key configured";
        for (TwitterDataProvider provider : chain.searchCapable()) {
            if (!provider.isConfigured(credentials)) continue;
            final ProviderResult<List<ScrapedTweet>> result = provider.searchRecent(credentials, clean, maxTweets);
            if (!result.isOk()) {
                lastError = provider.kind() + ": " + result.reason();
                continue;
            }
            final List<ScrapedTweet> all = result.value();
            final List<ScrapedTweet> matching = lowered.isEmpty() ? all : all.stream()
                    .filter(t -> containsAny(t.content(), lowered))
                    .toList();
            if (!matching.isEmpty()) {
                log.debug("{} found {} tweets for @{}", provider.kind(), matching.size(), clean);
                return KolSearchResult.found(clean, matching, provider.kind());
            }
            lastError = all.isEmpty()
                    ? "No tweets found for @" + clean
                    : "Found " + all.size() + " tweets from @" + clean + " but none matched keywords: "
                            + String.join(", ", keywords);
        }
        return KolSearchResult.failed(clean, lastError);
    }

    /** Searches KOLs one after another with a pause in between; keyed by lower-cased handle. */
    public Map<String, KolSearchResult> scrapeMultipleKols(final CredentialContext credentials, final List<String> handles,
                                                           final List<String> keywords, final int maxTweetsPerKol) {
        final Map<String, KolSearchResult> results = new LinkedHashMap<>();
        for (int i = 0; i < handles.size(); i++) {
            final String key = TweetIdentifiers.cleanHandle(handles.get(i)).toLowerCase(Locale.ROOT);
            if (i > 0 && credentials.hasAnyProviderConfigured()) {
                try {
                    pacer.pause(scrape.kolDelay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    results.put(key, KolSearchResult.failed(key, "interrupted"));
                    continue;
                }
            }
            log.info("Scraping KOL {}/{}: @{}", i + 1, handles.size(), key);
            results.put(key, searchKol(credentials, handles.get(i), keywords, maxTweetsPerKol));
        }
        return results;
    }

    static boolean containsAny(final String content, final List<String> loweredKeywords) {
        if (content == null) return false;
        final String lower = content.toLowerCase(Locale.ROOT);
        return loweredKeywords.stream().anyMatch(lower::contains);
    }

    private <T> ProviderResult<T> firstOk(final List<TwitterDataProvider> providers, final CredentialContext credentials,
                                          final String what, final Function<TwitterDataProvider, ProviderResult<T>> call) {
        final List<String> reasons = new ArrayList<>();
        for (TwitterDataProvider provider : providers) {
            if (!provider.isConfigured(credentials)) {
                reasons.add(provider.kind() + ": not configured");
                continue;
            }
            final ProviderResult<T> result = call.apply(provider);
            if (result.isOk()) {
                log.debug("{} served {}", provider.kind(), what);
                return result;
            }
            reasons.add(provider.kind() + ": " + result.reason());
        }
        return ProviderResult.unavailable(null, what + " unavailable (" + String.join("; ", reasons) + ")");
    }
}
