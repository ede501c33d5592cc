package quest.gekko.kolmetrics.service.integration.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import quest.gekko.kolmetrics.config.KolProperties;
import quest.gekko.kolmetrics.util.Pacer;
import quest.gekko.kolmetrics.util.RateLimiter;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the tweet scraper actor: start a run, poll until it reaches a terminal state or the
 * poll ceiling passes, then read the run's dataset.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApifyActorClient {
    private static final Set<String> FAILED_STATES = Set.of("FAILED", "ABORTED", "TIMED-OUT");

    private final WebClient http;
    private final RateLimiter rateLimiter;
    private final Pacer pacer;
    private final KolProperties.Providers providers;
    private final Clock clock;

    public static class ActorRunException extends RuntimeException {
        public ActorRunException(final String message) {
            super(message);
        }
    }

    /** Dataset items of a finished search run for {@code searchTerm}. */
    public List<JsonNode> search(final String token, final String searchTerm, final int maxItems)
            throws InterruptedException {
        final KolProperties.Apify cfg = providers.apify();
        final Map<String, Object> input = Map.of("searchTerms", List.of(searchTerm), "maxItems", maxItems);

        final JsonNode run = rateLimiter.call(() -> http.post()
                .uri(cfg.baseUrl() + "/v2/acts/{actor}/runs?token={token}", Map.of("actor", cfg.actorId(), "token", token))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(input)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(cfg.timeout())
                .block());
        final String runId = run == null ? "" : run.path("data").path("id").asText("");
        if (runId.isEmpty()) throw new ActorRunException("actor run did not start");
        log.debug("Apify run {} started for '{}'", runId, searchTerm);

        final String datasetId = awaitDataset(token, runId, cfg);
        final JsonNode items = rateLimiter.call(() -> http.get()
                .uri(cfg.baseUrl() + "/v2/datasets/{dataset}/items?token={token}&limit={limit}",
                        Map.of("dataset", datasetId, "token", token, "limit", maxItems))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(cfg.timeout())
                .block());

        final List<JsonNode> result = new ArrayList<>();
        if (items != null && items.isArray()) items.forEach(result::add);
        log.debug("Apify run {} returned {} raw items", runId, result.size());
        return result;
    }

    /** Polls until a terminal state; the whole loop, status calls included, ends at {@code pollTimeout}. */
    private String awaitDataset(final String token, final String runId, final KolProperties.Apify cfg)
            throws InterruptedException {
        final Instant deadline = clock.instant().plus(cfg.pollTimeout());

        while (true) {
            Duration left = Duration.between(clock.instant(), deadline);
            if (left.isNegative() || left.isZero()) break;
            pacer.pause(min(cfg.pollInterval(), left));

            left = Duration.between(clock.instant(), deadline);
            if (left.isNegative() || left.isZero()) break;
            final Duration callTimeout = min(cfg.timeout(), left);
            final JsonNode status;
            try {
                // a status call cut short by the deadline reads as "no answer yet"
                status = rateLimiter.call(() -> http.get()
                        .uri(cfg.baseUrl() + "/v2/actor-runs/{run}?token={token}", Map.of("run", runId, "token", token))
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .bodyToMono(JsonNode.class)
                        .timeout(callTimeout, Mono.empty())
                        .block());
            } catch (WebClientResponseException e) {
                log.debug("Apify status poll for run {} answered HTTP {}", runId, e.getStatusCode().value());
                continue;
            }
            final JsonNode data = status == null ? null : status.path("data");
            final String state = data == null ? "" : data.path("status").asText("");
            if ("SUCCEEDED".equals(state)) {
                final String datasetId = data.path("defaultDatasetId").asText("");
                if (datasetId.isEmpty()) throw new ActorRunException("run " + runId + " has no dataset");
                return datasetId;
            }
            if (FAILED_STATES.contains(state)) throw new ActorRunException("run " + runId + " ended " + state);
        }
        throw new ActorRunException("run " + runId + " still running after " + cfg.pollTimeout().toSeconds() + "s");
    }

    private static Duration min(final Duration a, final Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
