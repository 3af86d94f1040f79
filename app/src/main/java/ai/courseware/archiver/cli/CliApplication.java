package ai.courseware.archiver.cli;

import ai.courseware.archiver.config.Config;
import ai.courseware.archiver.config.ConfigLoader;
import ai.courseware.archiver.config.SystemEnvironmentReader;
import ai.courseware.archiver.document.PipelineException;
import ai.courseware.archiver.fetch.HttpPageFetcher;
import ai.courseware.archiver.fetch.PageFetcher;
import ai.courseware.archiver.logging.LoggingConfigurator;
import ai.courseware.archiver.run.CircuitOpened;
import ai.courseware.archiver.run.DownloadOrchestrator;
import ai.courseware.archiver.run.ItemProgress;
import ai.courseware.archiver.run.ItemStatus;
import ai.courseware.archiver.run.PagePipeline;
import ai.courseware.archiver.run.QueuedRunEvents;
import ai.courseware.archiver.run.RunCompleted;
import ai.courseware.archiver.run.RunEvent;
import ai.courseware.archiver.run.RunSummary;
import ai.courseware.archiver.run.ValidationException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and download orchestrator.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_PARTIAL_FAILURE = 1;
    static final int EXIT_FAILURE = 2;

    private static final Duration EVENT_POLL_INTERVAL = Duration.ofMillis(200);
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final ConfigLoader configLoader;
    private final PageFetcher pageFetcher;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new HttpPageFetcher());
    }

    CliApplication(ConfigLoader configLoader, PageFetcher pageFetcher) {
        this.configLoader = configLoader;
        this.pageFetcher = pageFetcher;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | UncheckedIOException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Archiving {} URL(s) with {}", config.urls().size(), config.runConfig());

        QueuedRunEvents events = new QueuedRunEvents();
        AtomicReference<CompletableFuture<RunSummary>> activeRun = new AtomicReference<>();
        try (DownloadOrchestrator orchestrator = new DownloadOrchestrator(new PagePipeline(pageFetcher), events)) {
            Thread shutdownHook = new Thread(() -> stopOnShutdown(orchestrator, activeRun.get()), "archiver-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
            try {
                CompletableFuture<RunSummary> future = orchestrator.start(config.urls(), config.runConfig());
                activeRun.set(future);
                return exitCode(awaitCompletion(events, future, orchestrator));
            } catch (ValidationException ex) {
                LOGGER.error("Invalid input: {}", ex.getMessage());
                return EXIT_FAILURE;
            } catch (PipelineException | UncheckedIOException ex) {
                LOGGER.error("Run could not start: {}", ex.getMessage());
                return EXIT_FAILURE;
            } catch (CompletionException ex) {
                LOGGER.error("Run failed unexpectedly", ex.getCause());
                return EXIT_FAILURE;
            } finally {
                removeShutdownHook(shutdownHook);
            }
        }
    }

    private RunSummary awaitCompletion(QueuedRunEvents events,
                                       CompletableFuture<RunSummary> future,
                                       DownloadOrchestrator orchestrator) {
        try {
            while (!future.isDone()) {
                events.poll(EVENT_POLL_INTERVAL).ifPresent(this::logEvent);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for the run; stopping");
            orchestrator.stop();
        }
        try {
            return future.join();
        } finally {
            events.drain().forEach(this::logEvent);
        }
    }

    private void logEvent(RunEvent event) {
        if (event instanceof ItemProgress progress) {
            if (progress.status() == ItemStatus.ERROR) {
                LOGGER.warn("[{}/{}] Failed {}: {}", progress.current(), progress.total(), progress.url(),
                        progress.error().orElse("unknown error"));
            } else if (progress.status() == ItemStatus.COMPLETED) {
                LOGGER.info("[{}/{}] Saved {}", progress.current(), progress.total(), progress.filename());
            } else {
                LOGGER.debug("[{}/{}] {} {}", progress.current(), progress.total(), progress.status(), progress.url());
            }
        } else if (event instanceof CircuitOpened circuit) {
            LOGGER.error("Circuit opened after {} consecutive failures at {}", circuit.consecutiveFailures(), circuit.url());
        } else if (event instanceof RunCompleted completed) {
            LOGGER.info("Completed: {} processed, {} failed, {} remaining",
                    completed.totalProcessed(), completed.totalErrors(), completed.remaining());
        }
    }

    static int exitCode(RunSummary summary) {
        if (summary.circuitOpen()) {
            return EXIT_FAILURE;
        }
        return summary.failed() > 0 ? EXIT_PARTIAL_FAILURE : EXIT_SUCCESS;
    }

    private static void stopOnShutdown(DownloadOrchestrator orchestrator, CompletableFuture<RunSummary> future) {
        if (!orchestrator.stop() || future == null) {
            return;
        }
        LOGGER.info("Shutdown requested; waiting for the current page to finish");
        try {
            future.get(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException ex) {
            LOGGER.warn("Run did not finish cleanly during shutdown: {}", ex.toString());
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            LOGGER.debug("JVM is already shutting down; keeping shutdown hook");
        }
    }
}
