package ai.courseware.archiver.run;

/**
 * Marker for everything published on the run event channel.
 */
public interface RunEvent {
}
