package quest.gekko.kolmetrics.service.integration.provider;

import org.springframework.http.HttpStatus;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.kolmetrics.config.KolProperties;
import quest.gekko.kolmetrics.util.RateLimiter;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/** WebClient whose responses are canned per request path; records every request it sees. */
final class StubWebClients {
    private record Canned(HttpStatus status, String json) {}

    private final Map<String, Canned> routes = new LinkedHashMap<>();
    final List<ClientRequest> requests = new ArrayList<>();
    private Consumer<ClientRequest> beforeResponse = request -> { };

    /** Runs for every request before its canned response; e.g. to let time pass. */
    StubWebClients beforeResponse(Consumer<ClientRequest> hook) {
        this.beforeResponse = hook;
        return this;
    }

    StubWebClients respond(String pathPrefix, HttpStatus status, String json) {
        routes.put(pathPrefix, new Canned(status, json));
        return this;
    }

    StubWebClients ok(String pathPrefix, String json) {
        return respond(pathPrefix, HttpStatus.OK, json);
    }

    WebClient build() {
        return WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    beforeResponse.accept(request);
                    String path = request.url().getPath();
                    return routes.entrySet().stream()
                            .filter(e -> path.startsWith(e.getKey()))
                            .findFirst()
                            .map(e -> Mono.just(ClientResponse.create(e.getValue().status())
                                    .header("Content-Type", "application/json")
                                    .body(e.getValue().json())
                                    .build()))
                            .orElseGet(() -> Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build()));
                })
                .build();
    }

    static RateLimiter singleAttemptLimiter() {
        return new RateLimiter(5, RetryTemplate.builder().maxAttempts(1).build());
    }

    static KolProperties.Providers providers() {
        return new KolProperties.Providers(
                new KolProperties.SocialData("https://sd.test", Duration.ofSeconds(5), Duration.ZERO),
                new KolProperties.Apify("https://apify.test", "actor-1", Duration.ZERO, Duration.ofSeconds(3),
                        Duration.ofSeconds(5)),
                new KolProperties.Syndication("https://cdn.test", Duration.ofSeconds(5)),
                5, 1, Duration.ZERO, Duration.ZERO, Duration.ofSeconds(1), Duration.ofSeconds(1));
    }
}
