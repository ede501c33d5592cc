package quest.gekko.kolmetrics.service.core;

public record ItemOutcome<T>(T item, boolean success, String error) {
    static <T> ItemOutcome<T> succeeded(final T item) {
        return new ItemOutcome<>(item, true, null);
    }

    static <T> ItemOutcome<T> failed(final T item, final String error) {
        return new ItemOutcome<>(item, false, error);
    }
}
