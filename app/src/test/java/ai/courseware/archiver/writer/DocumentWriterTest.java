package ai.courseware.archiver.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.courseware.archiver.render.OutputFormat;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesOneFilePerFormatAndCreatesDirectories() throws Exception {
        DocumentWriter writer = new DocumentWriter();
        Map<OutputFormat, String> outputs = new EnumMap<>(OutputFormat.class);
        outputs.put(OutputFormat.MARKDOWN, "# Title\n");
        outputs.put(OutputFormat.TEXT, "Title\n=====\n");
        Path target = tempDir.resolve("nested/out");

        List<Path> written = writer.write(target, "title", outputs);

        assertThat(written).containsExactly(target.resolve("title.md"), target.resolve("title.txt"));
        assertThat(Files.readString(target.resolve("title.md"), StandardCharsets.UTF_8)).isEqualTo("# Title\n");
    }

    @Test
    void overwritesExistingFiles() throws Exception {
        DocumentWriter writer = new DocumentWriter();
        writer.write(tempDir, "page", Map.of(OutputFormat.HTML, "<p>a much longer first version</p>"));

        writer.write(tempDir, "page", Map.of(OutputFormat.HTML, "<p>b</p>"));

        assertThat(Files.readString(tempDir.resolve("page.html"), StandardCharsets.UTF_8)).isEqualTo("<p>b</p>");
    }

    @Test
    void rejectsMissingBaseName() {
        DocumentWriter writer = new DocumentWriter();

        assertThatThrownBy(() -> writer.write(tempDir, " ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
