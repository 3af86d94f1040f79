package ai.courseware.archiver.cli;

import ai.courseware.archiver.config.LogFormat;
import ai.courseware.archiver.render.OutputFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "courseware-archiver", mixinStandardHelpOptions = true,
        description = "Archives authenticated course pages as markdown, HTML or text")
public class CliArguments {

    @CommandLine.Parameters(paramLabel = "URL", arity = "0..*", description = "Course or section page URLs")
    private List<String> urls = new ArrayList<>();

    @CommandLine.Option(names = "--cookies", description = "Session cookies as 'name=value; name=value'", paramLabel = "COOKIES")
    private String cookies;

    @CommandLine.Option(names = "--cookie-file", description = "Netscape cookies.txt export to read cookies from", paramLabel = "FILE")
    private Path cookieFile;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output directory", paramLabel = "DIR")
    private String outputDirectory;

    @CommandLine.Option(names = {"-f", "--format"}, split = ",", converter = OutputFormatConverter.class,
            description = "Output formats: md, html, txt", paramLabel = "FORMAT")
    private List<OutputFormat> formats = new ArrayList<>();

    @CommandLine.Option(names = "--rate-limit", description = "Seconds to wait between pages", paramLabel = "SECONDS")
    private Double rateLimitSeconds;

    @CommandLine.Option(names = "--max-failures", description = "Consecutive failures before the run stops", paramLabel = "COUNT")
    private Integer maxFailures;

    @CommandLine.Option(names = "--no-callouts", description = "Render semantic sections as plain markdown")
    private boolean noCallouts;

    @CommandLine.Option(names = "--no-embed-images", description = "Use standard image links instead of embeds")
    private boolean noEmbedImages;

    @CommandLine.Option(names = "--html-tables", description = "Keep tables as HTML in markdown output")
    private boolean htmlTables;

    @CommandLine.Option(names = "--metadata", description = "Write a front matter block into markdown output")
    private boolean metadata;

    @CommandLine.Option(names = "--tag", description = "Front matter tag (repeatable)", paramLabel = "TAG")
    private List<String> tags = new ArrayList<>();

    @CommandLine.Option(names = "--timestamp", description = "Add the archive time to the front matter")
    private boolean timestamp;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public List<String> urls() {
        return urls == null ? List.of() : List.copyOf(urls);
    }

    public String cookies() {
        return cookies;
    }

    public Path cookieFile() {
        return cookieFile;
    }

    public String outputDirectory() {
        return outputDirectory;
    }

    public List<OutputFormat> formats() {
        return formats == null ? List.of() : List.copyOf(formats);
    }

    public Double rateLimitSeconds() {
        return rateLimitSeconds;
    }

    public Integer maxFailures() {
        return maxFailures;
    }

    public boolean noCallouts() {
        return noCallouts;
    }

    public boolean noEmbedImages() {
        return noEmbedImages;
    }

    public boolean htmlTables() {
        return htmlTables;
    }

    public boolean metadata() {
        return metadata;
    }

    public List<String> tags() {
        return tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean timestamp() {
        return timestamp;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
