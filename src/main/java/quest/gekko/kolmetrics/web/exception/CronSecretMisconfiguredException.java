package quest.gekko.kolmetrics.web.exception;

public class CronSecretMisconfiguredException extends RuntimeException {
    public CronSecretMisconfiguredException() {
        super("Cron secret is not configured");
    }
}
