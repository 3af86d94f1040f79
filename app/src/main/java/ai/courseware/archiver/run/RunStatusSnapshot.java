package ai.courseware.archiver.run;

/**
 * Point-in-time view of the orchestrator state.
 */
public record RunStatusSnapshot(RunStatus status, int total, int processed, int failed, int consecutiveFailures) {
}
