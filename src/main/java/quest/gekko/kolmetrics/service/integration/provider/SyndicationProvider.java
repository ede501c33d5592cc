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
import quest.gekko.kolmetrics.util.RateLimiter;

import java.util.Map;

/**
 * Last-resort, unauthenticated embed endpoint. Tweets only, and metric coverage is partial;
 * nothing depends on it answering.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyndicationProvider implements TwitterDataProvider {
    private static final String BROWSER_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko)";

    private final WebClient http;
    private final RateLimiter rateLimiter;
    private final ProviderResponseMapper mapper;
    private final KolProperties.Providers providers;

    @Override
    public ProviderKind kind() { return ProviderKind.SYNDICATION; }

    @Override
    public ProviderResult<ScrapedTweet> fetchTweet(final CredentialContext credentials, final TweetReference tweet) {
        final KolProperties.Syndication cfg = providers.syndication();
        try {
            final JsonNode body = rateLimiter.call(() -> http.get()
                    .uri(cfg.baseUrl() + "/tweet-result?id={id}&token=0", Map.of("id", tweet.tweetId()))
                    .header(HttpHeaders.USER_AGENT, BROWSER_USER_AGENT)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(cfg.timeout())
                    .block());
            return mapper.toTweet(kind(), body, tweet.tweetId())
                    .map(t -> ProviderResult.ok(kind(), t))
                    .orElseGet(() -> ProviderResult.unavailable(kind(), "no tweet text in response"));
        } catch (RuntimeException e) {
            final String reason = ProviderErrors.describe(e);
            log.warn("Syndication tweet {} unavailable: {}", tweet.tweetId(), reason);
            return ProviderResult.unavailable(kind(), reason);
        }
    }
}
