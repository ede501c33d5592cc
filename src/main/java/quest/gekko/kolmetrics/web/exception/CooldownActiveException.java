package quest.gekko.kolmetrics.web.exception;

import lombok.Getter;

@Getter
public class CooldownActiveException extends RuntimeException {
    private final long minutesRemaining;

    public CooldownActiveException(final long minutesRemaining) {
        super("Metrics were refreshed recently. Try again in " + minutesRemaining + " minutes.");
        this.minutesRemaining = minutesRemaining;
    }
}
