package ai.courseware.archiver.run;

import java.util.Objects;

/**
 * Fatal event published when consecutive failures reach the configured threshold.
 */
public record CircuitOpened(String url, int consecutiveFailures, CircuitOpenException cause) implements RunEvent {

    public CircuitOpened {
        Objects.requireNonNull(cause, "cause");
    }
}
