package ai.courseware.archiver.run;

import ai.courseware.archiver.extract.CourseLinkDiscoverer;
import ai.courseware.archiver.extract.ExtractedPage;
import ai.courseware.archiver.render.FrontMatter;
import ai.courseware.archiver.render.RenderConfig;
import ai.courseware.archiver.writer.FileNameSanitizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives a download run: owns the work queue and the run state machine and processes items
 * sequentially on a single worker thread.
 *
 * <p>Control methods may be called from any thread. Pausing and stopping are cooperative and take
 * effect before the next item is dequeued; an in-flight fetch is never interrupted. When
 * {@code maxConsecutiveFailures} items fail in a row the run stops and a {@link CircuitOpened}
 * event is published. Every run ends with exactly one {@link RunCompleted} event.
 */
public class DownloadOrchestrator implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DownloadOrchestrator.class);

    static final Duration PAUSE_POLL_INTERVAL = Duration.ofMillis(100);
    static final String MDC_URL = "url";

    private final PagePipeline pipeline;
    private final RunEventSink events;
    private final RunValidator validator;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ExecutorService worker;
    private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.IDLE);
    private volatile RunState state = RunState.empty();

    public DownloadOrchestrator(PagePipeline pipeline, RunEventSink events) {
        this(pipeline, events, new RunValidator(), Sleeper.THREAD, Clock.systemUTC());
    }

    public DownloadOrchestrator(PagePipeline pipeline,
                                RunEventSink events,
                                RunValidator validator,
                                Sleeper sleeper,
                                Clock clock) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.events = Objects.requireNonNull(events, "events");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "archiver-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized CompletableFuture<RunSummary> start(List<String> urls, RunConfig config) {
        RunStatus current = status.get();
        if (current != RunStatus.IDLE) {
            throw new IllegalStateException("Cannot start a run while " + current);
        }
        List<URI> validated = validator.validate(urls, config);
        WorkQueue queue = buildQueue(validated, config);
        Path outputDirectory = Path.of(config.outputDirectory());
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to create output directory: " + outputDirectory, ex);
        }

        RunState run = new RunState(queue);
        state = run;
        status.set(RunStatus.RUNNING);
        LOGGER.info("Starting run with {} pages into {}", queue.size(), outputDirectory.toAbsolutePath());
        try {
            return CompletableFuture.supplyAsync(() -> runLoop(run, config, outputDirectory), worker);
        } catch (RuntimeException ex) {
            status.set(RunStatus.IDLE);
            throw ex;
        }
    }

    public boolean pause() {
        boolean paused = status.compareAndSet(RunStatus.RUNNING, RunStatus.PAUSED);
        if (paused) {
            LOGGER.info("Run paused");
        }
        return paused;
    }

    public boolean resume() {
        boolean resumed = status.compareAndSet(RunStatus.PAUSED, RunStatus.RUNNING);
        if (resumed) {
            LOGGER.info("Run resumed");
        }
        return resumed;
    }

    public boolean stop() {
        boolean stopping = status.compareAndSet(RunStatus.RUNNING, RunStatus.STOPPING)
                || status.compareAndSet(RunStatus.PAUSED, RunStatus.STOPPING);
        if (stopping) {
            LOGGER.info("Stop requested; finishing current item");
        }
        return stopping;
    }

    public RunStatusSnapshot status() {
        return state.snapshot(status.get());
    }

    @Override
    public void close() {
        stop();
        worker.shutdown();
    }

    private WorkQueue buildQueue(List<URI> urls, RunConfig config) {
        WorkQueue queue = new WorkQueue();
        for (URI url : urls) {
            if (!CourseLinkDiscoverer.isCourseUrl(url)) {
                queue.add(url);
                continue;
            }
            List<String> links = pipeline.discover(url, config);
            LOGGER.info("Discovered {} sections on {}", links.size(), url);
            for (String link : links) {
                enqueueDiscovered(queue, link, config);
            }
        }
        return queue;
    }

    private void enqueueDiscovered(WorkQueue queue, String link, RunConfig config) {
        URI uri;
        try {
            uri = URI.create(link);
        } catch (IllegalArgumentException ex) {
            LOGGER.warn("Skipping malformed section link {}: {}", link, ex.getMessage());
            return;
        }
        if (uri.getHost() == null || !uri.getHost().equalsIgnoreCase(config.allowedHost())) {
            LOGGER.warn("Skipping section link outside {}: {}", config.allowedHost(), link);
            return;
        }
        queue.add(uri);
    }

    private RunSummary runLoop(RunState run, RunConfig config, Path outputDirectory) {
        List<WorkItem> items = run.queue().items();
        int total = items.size();
        boolean circuitOpen = false;
        try {
            for (int index = 0; index < total; index++) {
                if (!awaitRunnable()) {
                    break;
                }
                WorkItem item = items.get(index);
                int consecutive = process(item, index + 1, total, run, config, outputDirectory);
                if (consecutive >= config.maxConsecutiveFailures()) {
                    openCircuit(item, consecutive, config);
                    circuitOpen = true;
                    break;
                }
                if (index < total - 1 && !rateLimit(config.rateLimit())) {
                    break;
                }
            }
        } finally {
            if (status.compareAndSet(RunStatus.STOPPING, RunStatus.STOPPED)) {
                LOGGER.info("Run stopped on request");
            }
            RunCompleted completed = new RunCompleted(run.processed(), run.failed(), run.remaining());
            LOGGER.info("Run finished: {} processed, {} failed, {} remaining",
                    completed.totalProcessed(), completed.totalErrors(), completed.remaining());
            events.publish(completed);
            state = RunState.empty();
            status.set(RunStatus.IDLE);
        }
        return new RunSummary(run.processed(), run.failed(), run.remaining(), circuitOpen);
    }

    private int process(WorkItem item, int current, int total, RunState run, RunConfig config, Path outputDirectory) {
        String url = item.url().toString();
        String fileName = "";
        item.transition(WorkState.IN_FLIGHT);
        MDC.put(MDC_URL, url);
        try {
            events.publish(ItemProgress.downloading(current, total, url));
            ExtractedPage page = pipeline.download(item.url(), config);
            fileName = FileNameSanitizer.sanitize(page.title());
            events.publish(ItemProgress.processing(current, total, url, fileName));
            pipeline.convert(item.url(), page, fileName, renderConfigFor(config), outputDirectory);
            run.recordSuccess(item);
            LOGGER.info("Archived [{}/{}] {}", current, total, fileName);
            events.publish(ItemProgress.completed(current, total, url, fileName));
            return 0;
        } catch (RuntimeException ex) {
            int consecutive = run.recordFailure(item);
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            LOGGER.warn("Failed to archive {} ({} consecutive failures): {}", url, consecutive, message);
            LOGGER.debug("Failure detail for {}", url, ex);
            events.publish(ItemProgress.error(current, total, url, fileName, message));
            return consecutive;
        } finally {
            MDC.remove(MDC_URL);
        }
    }

    private RenderConfig renderConfigFor(RunConfig config) {
        RenderConfig renderConfig = config.renderConfig();
        if (!config.includeTimestamp()) {
            return renderConfig;
        }
        FrontMatter frontMatter = renderConfig.frontMatter().orElseGet(FrontMatter::defaults);
        return renderConfig.withFrontMatter(frontMatter.withCreated(clock.instant()));
    }

    private void openCircuit(WorkItem item, int consecutive, RunConfig config) {
        status.set(RunStatus.STOPPED);
        CircuitOpenException exception = new CircuitOpenException(config.maxConsecutiveFailures(), item.url().toString());
        LOGGER.error(exception.getMessage());
        events.publish(new CircuitOpened(item.url().toString(), consecutive, exception));
    }

    /**
     * Blocks while paused. Returns false once a stop was requested.
     */
    private boolean awaitRunnable() {
        while (true) {
            RunStatus current = status.get();
            if (current == RunStatus.RUNNING) {
                return true;
            }
            if (current != RunStatus.PAUSED) {
                return false;
            }
            if (!sleep(PAUSE_POLL_INTERVAL)) {
                return false;
            }
        }
    }

    private boolean rateLimit(Duration delay) {
        if (delay.isZero() || status.get() == RunStatus.STOPPING) {
            return true;
        }
        return sleep(delay);
    }

    private boolean sleep(Duration duration) {
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Run interrupted; stopping");
            status.set(RunStatus.STOPPING);
            return false;
        }
    }
}
