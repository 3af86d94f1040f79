package ai.courseware.archiver.run;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Event channel backed by an unbounded blocking queue; consumers drain events in order.
 */
public class QueuedRunEvents implements RunEventSink {

    private final BlockingQueue<RunEvent> queue = new LinkedBlockingQueue<>();

    @Override
    public void publish(RunEvent event) {
        if (event != null) {
            queue.add(event);
        }
    }

    public RunEvent take() throws InterruptedException {
        return queue.take();
    }

    public Optional<RunEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public List<RunEvent> drain() {
        List<RunEvent> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }
}
