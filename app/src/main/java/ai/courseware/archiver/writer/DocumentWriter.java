package ai.courseware.archiver.writer;

import ai.courseware.archiver.render.OutputFormat;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes rendered documents into the output directory, one file per format.
 */
public class DocumentWriter {

    public List<Path> write(Path outputDirectory, String baseName, Map<OutputFormat, String> outputs) {
        if (outputDirectory == null || baseName == null || baseName.isBlank() || outputs == null) {
            throw new IllegalArgumentException("outputDirectory, baseName and outputs must be provided");
        }
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(outputDirectory);
            for (Map.Entry<OutputFormat, String> entry : outputs.entrySet()) {
                Path target = outputDirectory.resolve(baseName + "." + entry.getKey().extension());
                Files.writeString(target, entry.getValue(), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
                written.add(target);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write document: " + outputDirectory.resolve(baseName), ex);
        }
        return List.copyOf(written);
    }
}
