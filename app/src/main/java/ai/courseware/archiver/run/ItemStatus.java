package ai.courseware.archiver.run;

/**
 * Stage reported by an {@link ItemProgress} event.
 */
public enum ItemStatus {
    DOWNLOADING,
    PROCESSING,
    COMPLETED,
    ERROR
}
