package ai.courseware.archiver.run;

/**
 * Processing state of a single queued URL.
 */
public enum WorkState {
    PENDING,
    IN_FLIGHT,
    DONE,
    FAILED
}
