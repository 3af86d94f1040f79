package ai.courseware.archiver.render;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rendered documents per output format plus the image sources referenced while rendering.
 */
public record RenderResult(Map<OutputFormat, String> outputs, List<String> imageReferences) {

    public RenderResult {
        Objects.requireNonNull(outputs, "outputs");
        outputs = outputs.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(OutputFormat.class))
                : Collections.unmodifiableMap(new EnumMap<>(outputs));
        imageReferences = imageReferences == null ? List.of() : List.copyOf(imageReferences);
    }

    public String output(OutputFormat format) {
        String value = outputs.get(format);
        if (value == null) {
            throw new IllegalArgumentException("Format was not rendered: " + format);
        }
        return value;
    }
}
