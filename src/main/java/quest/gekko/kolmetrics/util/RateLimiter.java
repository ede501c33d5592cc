package quest.gekko.kolmetrics.util;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import quest.gekko.kolmetrics.config.KolProperties;

import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;

/**
 * Gate for outbound provider calls: bounds how many run at once and retries transient
 * failures (429, 5xx, connection errors). Anything else is rethrown on the first attempt.
 */
@Component
public class RateLimiter {
    private final Semaphore sem;
    private final RetryTemplate retryTemplate;

    @Autowired
    public RateLimiter(final KolProperties.Providers providers, final Pacer pacer) {
        this(providers.maxConcurrentCalls(), RetryTemplate.builder()
                .maxAttempts(providers.maxAttempts())
                .customBackoff(new RetryAfterBackOffPolicy(
                        providers.initialBackoff(), providers.maxBackoff(), pacer))
                .retryOn(TransientProviderException.class)
                .build());
    }

    public RateLimiter(final int permits, final RetryTemplate retryTemplate) {
        this.sem = new Semaphore(permits);
        this.retryTemplate = retryTemplate;
    }

    public <T> T call(final Callable<T> c) {
        try {
            sem.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for a provider call slot", e);
        }
        try {
            return retryTemplate.execute(ctx -> attempt(c));
        } catch (TransientProviderException e) {
            throw e.getCause() instanceof RuntimeException re ? re : e;
        } finally {
            sem.release();
        }
    }

    private static <T> T attempt(final Callable<T> c) {
        try {
            return c.call();
        } catch (WebClientResponseException e) {
            if (isTransient(e.getStatusCode().value())) throw new TransientProviderException(e);
            throw e;
        } catch (WebClientRequestException e) {
            throw new TransientProviderException(e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    static boolean isTransient(final int status) {
        return status == HttpStatus.TOO_MANY_REQUESTS.value() || status >= 500;
    }
}
