package ai.courseware.archiver.config;

import ai.courseware.archiver.run.RunConfig;
import java.util.List;
import java.util.Objects;

/**
 * Fully resolved application configuration: the URLs to archive, the run settings and the log format.
 */
public record Config(List<String> urls, RunConfig runConfig, LogFormat logFormat) {

    public Config {
        urls = List.copyOf(urls == null ? List.of() : urls);
        runConfig = Objects.requireNonNull(runConfig, "runConfig");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }
}
