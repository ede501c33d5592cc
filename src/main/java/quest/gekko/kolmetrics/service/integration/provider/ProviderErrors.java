package quest.gekko.kolmetrics.service.integration.provider;

import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/** Short, secret-free failure descriptions for provider results and logs. */
final class ProviderErrors {
    private static final int MAX_BODY = 200;

    private ProviderErrors() {}

    static String describe(final Throwable error) {
        if (error instanceof WebClientResponseException e) {
            if (e.getStatusCode().value() == 402) return "HTTP 402: out of credits";
            final String body = e.getResponseBodyAsString();
            return "HTTP " + e.getStatusCode().value()
                    + (body.isBlank() ? "" : ": " + body.substring(0, Math.min(body.length(), MAX_BODY)));
        }
        final Throwable cause = error.getCause();
        if (error instanceof TimeoutException || cause instanceof TimeoutException) return "timed out";
        return error.getClass().getSimpleName() + (error.getMessage() == null ? "" : ": " + error.getMessage());
    }
}
