package quest.gekko.kolmetrics.service.integration.provider;

import java.util.Objects;

/** Either a normalized value or the reason the provider could not produce one. */
public record ProviderResult<T>(T value, ProviderKind provider, String reason) {

    public static <T> ProviderResult<T> ok(final ProviderKind provider, final T value) {
        return new ProviderResult<>(Objects.requireNonNull(value), provider, null);
    }

    public static <T> ProviderResult<T> unavailable(final ProviderKind provider, final String reason) {
        return new ProviderResult<>(null, provider, reason);
    }

    public boolean isOk() {
        return value != null;
    }
}
