package quest.gekko.kolmetrics.service.core;

import java.util.List;
import java.util.Objects;

public record BatchResult<T>(int total, int succeeded, int failed, int batches, List<ItemOutcome<T>> results) {

    static <T> BatchResult<T> of(final List<ItemOutcome<T>> results, final int batches) {
        final int ok = (int) results.stream().filter(ItemOutcome::success).count();
        return new BatchResult<>(results.size(), ok, results.size() - ok, batches, List.copyOf(results));
    }

    public static <T> BatchResult<T> empty() {
        return new BatchResult<>(0, 0, 0, 0, List.of());
    }

    public List<String> sampleErrors(final int limit) {
        return results.stream()
                .filter(r -> !r.success())
                .map(ItemOutcome::error)
                .filter(Objects::nonNull)
                .limit(limit)
                .toList();
    }
}
