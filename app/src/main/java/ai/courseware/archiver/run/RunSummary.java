package ai.courseware.archiver.run;

/**
 * Outcome of a finished run.
 */
public record RunSummary(int processed, int failed, int remaining, boolean circuitOpen) {

    public boolean successful() {
        return failed == 0 && !circuitOpen;
    }
}
