package quest.gekko.kolmetrics.service.integration.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.kolmetrics.config.KolProperties;
import quest.gekko.kolmetrics.service.credentials.CredentialContext;
import quest.gekko.kolmetrics.util.Pacer;
import quest.gekko.kolmetrics.util.RateLimiter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Primary provider: a keyed REST API returning Twitter-shaped JSON. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SocialDataProvider implements TwitterDataProvider {
    private static final int PAGE_SIZE = 20;

    private final WebClient http;
    private final RateLimiter rateLimiter;
    private final ProviderResponseMapper mapper;
    private final Pacer pacer;
    private final KolProperties.Providers providers;

    @Override
    public ProviderKind kind() { return ProviderKind.SOCIALDATA; }

    @Override
    public boolean supportsProfiles() { return true; }

    @Override
    public boolean supportsSearch() { return true; }

    @Override
    public ProviderResult<ScrapedTweet> fetchTweet(final CredentialContext credentials, final TweetReference tweet) {
        if (!isConfigured(credentials)) return ProviderResult.unavailable(kind(), "no API key configured");
        try {
            final JsonNode body = get(credentials, "/twitter/tweets/{id}", Map.of("id", tweet.tweetId()));
            return mapper.toTweet(kind(), body, tweet.tweetId())
                    .map(t -> ProviderResult.ok(kind(), t))
                    .orElseGet(() -> ProviderResult.unavailable(kind(), "no tweet content in response"));
        } catch (RuntimeException e) {
            return failed("tweet " + tweet.tweetId(), e);
        }
    }

    @Override
    public ProviderResult<ScrapedProfile> fetchProfile(final CredentialContext credentials, final String handle) {
        if (!isConfigured(credentials)) return ProviderResult.unavailable(kind(), "no API key configured");
        try {
            final JsonNode body = get(credentials, "/twitter/user/{handle}", Map.of("handle", handle.toLowerCase()));
            return ProviderResult.ok(kind(), mapper.toProfile(kind(), body, handle));
        } catch (RuntimeException e) {
            return failed("profile @" + handle, e);
        }
    }

    @Override
    public ProviderResult<List<ScrapedTweet>> searchRecent(final CredentialContext credentials, final String handle,
                                                           final int maxTweets) {
        if (!isConfigured(credentials)) return ProviderResult.unavailable(kind(), "no API key configured");
        final String query = "from:" + handle;
        final int maxPages = Math.max(1, (maxTweets + PAGE_SIZE - 1) / PAGE_SIZE);
        final List<ScrapedTweet> found = new ArrayList<>();
        String cursor = null;
        try {
            for (int page = 0; page < maxPages && found.size() < maxTweets; page++) {
                if (page > 0) pacer.pause(providers.socialdata().pageDelay());
                final JsonNode body = cursor == null
                        ? get(credentials, "/twitter/search?query={q}", Map.of("q", query))
                        : get(credentials, "/twitter/search?query={q}&cursor={c}", Map.of("q", query, "c", cursor));
                final JsonNode tweets = body == null ? null : body.path("tweets");
                if (tweets == null || !tweets.isArray() || tweets.isEmpty()) break;

                for (JsonNode item : tweets) {
                    final String content = item.path("full_text").asText(item.path("text").asText(""));
                    if (mapper.isRetweetOrForeignReply(kind(), item, content, handle)) continue;
                    mapper.toTweet(kind(), item, null).ifPresent(found::add);
                }
                cursor = Optional.ofNullable(body.get("next_cursor")).filter(c -> !c.isNull())
                        .map(JsonNode::asText).filter(c -> !c.isBlank()).orElse(null);
                if (cursor == null) break;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProviderResult.unavailable(kind(), "interrupted");
        } catch (RuntimeException e) {
            if (found.isEmpty()) return failed("search @" + handle, e);
            log.warn("SocialData search for @{} stopped early after {} tweets: {}", handle, found.size(),
                    ProviderErrors.describe(e));
        }
        log.debug("SocialData search for @{} returned {} tweets", handle, found.size());
        return ProviderResult.ok(kind(), found.size() > maxTweets ? List.copyOf(found.subList(0, maxTweets)) : found);
    }

    private JsonNode get(final CredentialContext credentials, final String path, final Map<String, ?> vars) {
        final String apiKey = credentials.socialDataApiKey();
        return rateLimiter.call(() -> http.get()
                .uri(providers.socialdata().baseUrl() + path, vars)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(providers.socialdata().timeout())
                .block());
    }

    private <T> ProviderResult<T> failed(final String what, final RuntimeException e) {
        final String reason = ProviderErrors.describe(e);
        log.warn("SocialData {} unavailable: {}", what, reason);
        return ProviderResult.unavailable(kind(), reason);
    }
}
