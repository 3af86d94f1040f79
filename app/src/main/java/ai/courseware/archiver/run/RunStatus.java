package ai.courseware.archiver.run;

/**
 * Lifecycle states of a download run.
 */
public enum RunStatus {
    IDLE,
    RUNNING,
    PAUSED,
    STOPPING,
    STOPPED
}
