package quest.gekko.kolmetrics.service.analytics;

import java.time.Duration;
import java.util.Arrays;

public enum AnalyticsPeriod {
    D7("7d", 7),
    D14("14d", 14),
    D30("30d", 30),
    D90("90d", 90),
    D365("365d", 365);

    private final String key;
    private final int days;

    AnalyticsPeriod(final String key, final int days) {
        this.key = key;
        this.days = days;
    }

    public String key() {
        return key;
    }

    public Duration length() {
        return Duration.ofDays(days);
    }

    /** Unknown or missing keys resolve to {@code fallback}. */
    public static AnalyticsPeriod parse(final String key, final AnalyticsPeriod fallback) {
        if (key == null) return fallback;
        return Arrays.stream(values())
                .filter(p -> p.key.equalsIgnoreCase(key.trim()))
                .findFirst()
                .orElse(fallback);
    }
}
