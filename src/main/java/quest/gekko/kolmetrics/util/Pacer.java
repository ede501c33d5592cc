package quest.gekko.kolmetrics.util;

import java.time.Duration;

/** Blocking pause between provider calls, batches and poll attempts. */
@FunctionalInterface
public interface Pacer {
    void pause(Duration delay) throws InterruptedException;
}
