package quest.gekko.kolmetrics.util;

import org.springframework.http.HttpHeaders;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Exponential backoff that waits for the server's {@code Retry-After} (in seconds) instead
 * when the last failure carried one. Both waits are capped at {@code max}.
 */
public class RetryAfterBackOffPolicy implements BackOffPolicy {
    private final long initialMillis;
    private final long maxMillis;
    private final Pacer pacer;

    public RetryAfterBackOffPolicy(final Duration initial, final Duration max, final Pacer pacer) {
        this.initialMillis = initial.toMillis();
        this.maxMillis = Math.max(max.toMillis(), initialMillis);
        this.pacer = pacer;
    }

    @Override
    public BackOffContext start(final RetryContext context) {
        return new Context(context, initialMillis);
    }

    @Override
    public void backOff(final BackOffContext backOffContext) {
        final Context ctx = (Context) backOffContext;
        final long retryAfter = retryAfterMillis(ctx.retry.getLastThrowable());
        final long wait = Math.min(retryAfter >= 0 ? retryAfter : ctx.nextMillis, maxMillis);
        ctx.nextMillis = Math.min(ctx.nextMillis * 2, maxMillis);
        try {
            pacer.pause(Duration.ofMillis(wait));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted while backing off", e);
        }
    }

    static long retryAfterMillis(final Throwable failure) {
        Throwable t = failure;
        while (t != null && !(t instanceof WebClientResponseException)) {
            t = t.getCause();
        }
        if (t == null) return -1;
        final String header = ((WebClientResponseException) t).getHeaders().getFirst(HttpHeaders.RETRY_AFTER);
        if (header == null) return -1;
        try {
            return Duration.ofSeconds(Long.parseLong(header.trim())).toMillis();
        } catch (NumberFormatException e) {
            // HTTP-date form is not worth parsing here, fall back to exponential
            return -1;
        }
    }

    private static final class Context implements BackOffContext {
        private final RetryContext retry;
        private long nextMillis;

        private Context(final RetryContext retry, final long nextMillis) {
            this.retry = retry;
            this.nextMillis = nextMillis;
        }
    }
}
