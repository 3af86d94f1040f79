package ai.courseware.archiver.run;

/**
 * Single channel that receives every run event in publication order.
 */
@FunctionalInterface
public interface RunEventSink {

    void publish(RunEvent event);

    static RunEventSink discarding() {
        return event -> {
        };
    }
}
