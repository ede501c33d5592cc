package quest.gekko.kolmetrics.service.core;

/** Every provider in the chain failed for one item. */
public class ProviderUnavailableException extends RuntimeException {
    public ProviderUnavailableException(final String reason) {
        super(reason);
    }
}
