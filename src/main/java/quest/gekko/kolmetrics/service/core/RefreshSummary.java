package quest.gekko.kolmetrics.service.core;

import java.util.List;

public record RefreshSummary(String status, Counts posts, Counts kols, String apiKeySource, List<String> errors) {

    /** {@code skipped} is true when the whole group was left out, e.g. for lack of credentials. */
    public record Counts(int total, int success, int failed, boolean skipped) {
        static Counts of(final BatchResult<?> result) {
            return new Counts(result.total(), result.succeeded(), result.failed(), false);
        }

        static Counts skipped(final int total) {
            return new Counts(total, 0, 0, true);
        }
    }

    static RefreshSummary alreadyRunning() {
        return new RefreshSummary("already-running", Counts.skipped(0), Counts.skipped(0), "none", List.of());
    }
}
