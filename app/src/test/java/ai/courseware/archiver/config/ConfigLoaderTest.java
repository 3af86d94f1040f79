package ai.courseware.archiver.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.courseware.archiver.cli.CliArguments;
import ai.courseware.archiver.extract.ContentExtractor;
import ai.courseware.archiver.render.OutputFormat;
import ai.courseware.archiver.run.RunConfig;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--cookies", "htb_academy_session=abc",
                "--output", "notes",
                "--format", "md,html",
                "--format", "txt",
                "--rate-limit", "0.5",
                "--max-failures", "5",
                "--no-callouts",
                "--no-embed-images",
                "--html-tables",
                "--metadata",
                "--tag", "linux",
                "--timestamp",
                "--log-format", "json",
                "https://academy.hackthebox.com/module/1/section/2");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        RunConfig run = config.runConfig();
        assertThat(config.urls()).containsExactly("https://academy.hackthebox.com/module/1/section/2");
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(run.credential()).isEqualTo("htb_academy_session=abc");
        assertThat(run.outputDirectory()).isEqualTo("notes");
        assertThat(run.rateLimit()).isEqualTo(Duration.ofMillis(500));
        assertThat(run.maxConsecutiveFailures()).isEqualTo(5);
        assertThat(run.includeTimestamp()).isTrue();
        assertThat(run.renderConfig().formats())
                .containsExactlyInAnyOrder(OutputFormat.MARKDOWN, OutputFormat.HTML, OutputFormat.TEXT);
        assertThat(run.renderConfig().calloutsEnabled()).isFalse();
        assertThat(run.renderConfig().embedImages()).isFalse();
        assertThat(run.renderConfig().pipeTables()).isFalse();
        assertThat(run.renderConfig().frontMatter()).hasValueSatisfying(
                frontMatter -> assertThat(frontMatter.tags()).containsExactly("linux"));
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_COURSE_COOKIES, " sid=1 ");
        envValues.put(ConfigLoader.ENV_OUTPUT_DIR, "archive");
        envValues.put(ConfigLoader.ENV_OUTPUT_FORMATS, "html, text");
        envValues.put(ConfigLoader.ENV_RATE_LIMIT_SECONDS, "2");
        envValues.put(ConfigLoader.ENV_MAX_CONSECUTIVE_FAILURES, "4");
        envValues.put(ConfigLoader.ENV_ALLOWED_HOST, "courses.example.org");
        envValues.put(ConfigLoader.ENV_SESSION_COOKIE_NAME, "sid");
        envValues.put(ConfigLoader.ENV_CONTENT_SELECTORS, "main.lesson; div.body, section.body");
        envValues.put(ConfigLoader.ENV_CLEANUP_SELECTORS, ".ads");
        envValues.put(ConfigLoader.ENV_CALLOUTS_ENABLED, "false");
        envValues.put(ConfigLoader.ENV_EMBED_IMAGES, "0");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "text");

        Config config = new ConfigLoader(new MapEnvironmentReader(envValues)).load(CommandLine.populateCommand(new CliArguments()));

        RunConfig run = config.runConfig();
        assertThat(run.credential()).isEqualTo("sid=1");
        assertThat(run.outputDirectory()).isEqualTo("archive");
        assertThat(run.renderConfig().formats()).containsExactlyInAnyOrder(OutputFormat.HTML, OutputFormat.TEXT);
        assertThat(run.rateLimit()).isEqualTo(Duration.ofSeconds(2));
        assertThat(run.maxConsecutiveFailures()).isEqualTo(4);
        assertThat(run.allowedHost()).isEqualTo("courses.example.org");
        assertThat(run.sessionCookieName()).isEqualTo("sid");
        assertThat(run.contentSelectors()).containsExactly("main.lesson", "div.body, section.body");
        assertThat(run.cleanupSelectors()).containsExactly(".ads");
        assertThat(run.renderConfig().calloutsEnabled()).isFalse();
        assertThat(run.renderConfig().embedImages()).isFalse();
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void appliesDefaultsWhenNothingConfigured() {
        Config config = new ConfigLoader(key -> Optional.empty()).load(CommandLine.populateCommand(new CliArguments()));

        RunConfig run = config.runConfig();
        assertThat(config.urls()).isEmpty();
        assertThat(run.credential()).isEmpty();
        assertThat(run.outputDirectory()).isEqualTo(ConfigLoader.DEFAULT_OUTPUT_DIR);
        assertThat(run.rateLimit()).isEqualTo(RunConfig.DEFAULT_RATE_LIMIT);
        assertThat(run.maxConsecutiveFailures()).isEqualTo(3);
        assertThat(run.allowedHost()).isEqualTo("academy.hackthebox.com");
        assertThat(run.contentSelectors()).isEqualTo(ContentExtractor.DEFAULT_CONTENT_SELECTORS);
        assertThat(run.renderConfig().formats()).containsExactly(OutputFormat.MARKDOWN);
        assertThat(run.renderConfig().calloutsEnabled()).isTrue();
        assertThat(run.renderConfig().frontMatter()).isEmpty();
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void readsCookiesFromNetscapeFile() throws Exception {
        Path cookieFile = tempDir.resolve("cookies.txt");
        Files.writeString(cookieFile, "# Netscape HTTP Cookie File\n"
                + ".academy.hackthebox.com\tTRUE\t/\tTRUE\t0\thtb_academy_session\txyz\n", StandardCharsets.UTF_8);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--cookie-file", cookieFile.toString());

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.runConfig().credential()).isEqualTo("htb_academy_session=xyz");
    }

    @Test
    void cliCookiesTakePrecedenceOverEnvironment() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--cookies", "a=1");

        Config config = new ConfigLoader(new MapEnvironmentReader(Map.of(ConfigLoader.ENV_COURSE_COOKIES, "b=2")))
                .load(cliArguments);

        assertThat(config.runConfig().credential()).isEqualTo("a=1");
    }

    @Test
    void rejectsMalformedNumbers() {
        ConfigLoader loader = new ConfigLoader(new MapEnvironmentReader(Map.of(ConfigLoader.ENV_MAX_CONSECUTIVE_FAILURES, "three")));

        Throwable thrown = catchThrowable(() -> loader.load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_MAX_CONSECUTIVE_FAILURES);
    }

    @Test
    void rejectsUnknownBooleans() {
        ConfigLoader loader = new ConfigLoader(new MapEnvironmentReader(Map.of(ConfigLoader.ENV_EMBED_IMAGES, "maybe")));

        Throwable thrown = catchThrowable(() -> loader.load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
    }

    private static final class MapEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;

        MapEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            return Optional.ofNullable(values.get(key));
        }
    }
}
