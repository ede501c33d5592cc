package quest.gekko.kolmetrics.util;

/** A provider failure worth retrying: HTTP 429, a 5xx, or an I/O error before any response. */
public class TransientProviderException extends RuntimeException {
    public TransientProviderException(final Throwable cause) {
        super(cause.getMessage(), cause);
    }
}
