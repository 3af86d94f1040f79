package ai.courseware.archiver.cli;

import ai.courseware.archiver.render.OutputFormat;
import picocli.CommandLine;

/**
 * Parses output format CLI options such as {@code md} or {@code html}.
 */
public class OutputFormatConverter implements CommandLine.ITypeConverter<OutputFormat> {
    @Override
    public OutputFormat convert(String value) {
        return OutputFormat.from(value);
    }
}
