package ai.courseware.archiver.run;

/**
 * Signals that a run was halted after too many consecutive item failures.
 */
public class CircuitOpenException extends RuntimeException {

    private final int threshold;
    private final String lastUrl;

    public CircuitOpenException(int threshold, String lastUrl) {
        super("Stopped after " + threshold + " consecutive failures; last failing URL: " + lastUrl);
        this.threshold = threshold;
        this.lastUrl = lastUrl;
    }

    public int threshold() {
        return threshold;
    }

    public String lastUrl() {
        return lastUrl;
    }
}
