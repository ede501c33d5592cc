package quest.gekko.kolmetrics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import quest.gekko.kolmetrics.util.Pacer;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Pacer pacer() {
        return delay -> {
            if (!delay.isZero() && !delay.isNegative()) Thread.sleep(delay.toMillis());
        };
    }

    /** Runs the items of one batch side by side; sized to the largest configured batch. */
    @Bean
    public ThreadPoolTaskExecutor metricsFetchExecutor(final KolProperties.Refresh refresh) {
        final int size = Math.max(refresh.postBatchSize(),
                Math.max(refresh.kolBatchSize(), refresh.refreshAllBatchSize()));
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(size * 4);
        executor.setThreadNamePrefix("metrics-fetch-");
        // overlapping tenant runs share this pool; when it is full the submitting thread does the work
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
