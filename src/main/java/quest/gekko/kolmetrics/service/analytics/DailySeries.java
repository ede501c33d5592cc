package quest.gekko.kolmetrics.service.analytics;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

/** Collapses time-ordered snapshots into one point per UTC day, keeping the day's last snapshot. */
final class DailySeries {
    private DailySeries() {}

    static <S, P> List<P> lastPerDay(final List<S> ascending, final Function<S, Instant> capturedAt,
                                     final BiFunction<String, S, P> toPoint) {
        final Map<String, S> byDay = new LinkedHashMap<>();
        for (S snapshot : ascending) {
            byDay.put(capturedAt.apply(snapshot).atZone(ZoneOffset.UTC).toLocalDate().toString(), snapshot);
        }
        return byDay.entrySet().stream()
                .map(e -> toPoint.apply(e.getKey(), e.getValue()))
                .toList();
    }
}
