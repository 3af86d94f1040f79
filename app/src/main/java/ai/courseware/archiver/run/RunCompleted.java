package ai.courseware.archiver.run;

/**
 * Terminal event published exactly once per run.
 */
public record RunCompleted(int totalProcessed, int totalErrors, int remaining) implements RunEvent {
}
