package quest.gekko.kolmetrics.web.exception;

import lombok.Getter;

/** No usable tenant session (401), or a session not allowed to use the endpoint (403). */
@Getter
public class TenantAccessException extends RuntimeException {
    private final boolean authenticated;

    private TenantAccessException(final String message, final boolean authenticated) {
        super(message);
        this.authenticated = authenticated;
    }

    public static TenantAccessException unauthenticated() {
        return new TenantAccessException("Unauthorized", false);
    }

    public static TenantAccessException forbidden(final String message) {
        return new TenantAccessException(message, true);
    }
}
