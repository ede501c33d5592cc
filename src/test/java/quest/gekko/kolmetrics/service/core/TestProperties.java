package quest.gekko.kolmetrics.service.core;

import quest.gekko.kolmetrics.config.KolProperties;

import java.time.Duration;

final class TestProperties {
    private TestProperties() {}

    static KolProperties.Refresh refresh() {
        return new KolProperties.Refresh(10, 10, 5, Duration.ofSeconds(1), Duration.ofMillis(500),
                Duration.ofDays(30), Duration.ofHours(1), null, false, "0 0 */6 * * *");
    }

    static KolProperties.Scrape scrape() {
        return new KolProperties.Scrape(30, Duration.ZERO);
    }

    static BatchOrchestrator inlineOrchestrator() {
        return new BatchOrchestrator(Runnable::run, delay -> { });
    }
}
