package ai.courseware.archiver.run;

import java.time.Duration;

/**
 * Blocking wait used for rate limiting and pause polling, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
