package ai.courseware.archiver.render;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Per-call rendering state. A fresh context is created for every document so that renders never
 * share or leak state.
 */
final class RenderContext {

    private static final String DEFAULT_IMAGE_NAME = "image.png";

    private final RenderConfig config;
    private final Set<String> imageReferences = new LinkedHashSet<>();

    RenderContext(RenderConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    RenderConfig config() {
        return config;
    }

    String image(String src, String alt) {
        String source = src == null ? "" : src.trim();
        if (!source.isEmpty()) {
            imageReferences.add(source);
        }
        if (config.embedImages()) {
            return "![[" + imageName(source) + "]]";
        }
        return "![" + (alt == null ? "" : alt.trim()) + "](" + source + ")";
    }

    List<String> imageReferences() {
        return List.copyOf(imageReferences);
    }

    static String imageName(String src) {
        String path = src == null ? "" : src;
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        int authority = path.indexOf("://");
        if (authority >= 0) {
            int pathStart = path.indexOf('/', authority + 3);
            path = pathStart >= 0 ? path.substring(pathStart) : "";
        }
        int slash = path.lastIndexOf('/');
        String name = slash >= 0 ? path.substring(slash + 1) : path;
        if (name.isBlank()) {
            return DEFAULT_IMAGE_NAME;
        }
        if (name.lastIndexOf('.') <= 0) {
            return name + ".png";
        }
        return name;
    }

    private static int indexOfAny(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) {
            return b;
        }
        if (b < 0) {
            return a;
        }
        return Math.min(a, b);
    }
}
