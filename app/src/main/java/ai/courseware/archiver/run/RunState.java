package ai.courseware.archiver.run;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters and queue of the active run. Mutated only by the orchestrator loop.
 */
final class RunState {

    private final WorkQueue queue;
    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    RunState(WorkQueue queue) {
        this.queue = queue;
    }

    static RunState empty() {
        return new RunState(new WorkQueue());
    }

    WorkQueue queue() {
        return queue;
    }

    void recordSuccess(WorkItem item) {
        item.transition(WorkState.DONE);
        processed.incrementAndGet();
        consecutiveFailures.set(0);
    }

    int recordFailure(WorkItem item) {
        item.transition(WorkState.FAILED);
        failed.incrementAndGet();
        return consecutiveFailures.incrementAndGet();
    }

    int processed() {
        return processed.get();
    }

    int failed() {
        return failed.get();
    }

    int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    int remaining() {
        return queue.count(WorkState.PENDING) + queue.count(WorkState.IN_FLIGHT);
    }

    RunStatusSnapshot snapshot(RunStatus status) {
        return new RunStatusSnapshot(status, queue.size(), processed(), failed(), consecutiveFailures());
    }
}
