package ai.courseware.archiver.render;

import ai.courseware.archiver.document.SectionKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Renderer options.
 *
 * @param formats        formats to produce, {@code MARKDOWN} when empty
 * @param calloutsEnabled whether semantic sections become {@code > [!token]} callouts
 * @param calloutTokens  callout token per section kind, merged over the default table
 * @param embedImages    {@code ![[name]]} embeds when true, {@code ![alt](src)} otherwise
 * @param pipeTables     pipe tables when true, raw table HTML otherwise
 * @param frontMatter    optional metadata block for markdown output
 */
public record RenderConfig(Set<OutputFormat> formats,
                           boolean calloutsEnabled,
                           Map<SectionKind, String> calloutTokens,
                           boolean embedImages,
                           boolean pipeTables,
                           Optional<FrontMatter> frontMatter) {

    private static final Map<SectionKind, String> DEFAULT_TOKENS = createDefaultTokens();

    public RenderConfig {
        formats = formats == null || formats.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.of(OutputFormat.MARKDOWN))
                : Collections.unmodifiableSet(EnumSet.copyOf(formats));
        Map<SectionKind, String> tokens = new EnumMap<>(DEFAULT_TOKENS);
        if (calloutTokens != null) {
            calloutTokens.forEach((kind, token) -> {
                if (kind != null && kind.isCallout() && token != null && !token.isBlank()) {
                    tokens.put(kind, token.trim());
                }
            });
        }
        calloutTokens = Collections.unmodifiableMap(tokens);
        frontMatter = frontMatter == null ? Optional.empty() : frontMatter;
    }

    private static Map<SectionKind, String> createDefaultTokens() {
        Map<SectionKind, String> tokens = new EnumMap<>(SectionKind.class);
        for (SectionKind kind : SectionKind.values()) {
            if (kind.isCallout()) {
                tokens.put(kind, kind.name().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableMap(tokens);
    }

    public static RenderConfig defaults() {
        return new RenderConfig(EnumSet.of(OutputFormat.MARKDOWN), true, Map.of(), true, true, Optional.empty());
    }

    public String calloutToken(SectionKind kind) {
        return calloutTokens.getOrDefault(kind, kind.name().toLowerCase(Locale.ROOT));
    }

    public RenderConfig withFormats(Set<OutputFormat> value) {
        return new RenderConfig(value, calloutsEnabled, calloutTokens, embedImages, pipeTables, frontMatter);
    }

    public RenderConfig withCalloutsEnabled(boolean value) {
        return new RenderConfig(formats, value, calloutTokens, embedImages, pipeTables, frontMatter);
    }

    public RenderConfig withCalloutTokens(Map<SectionKind, String> value) {
        return new RenderConfig(formats, calloutsEnabled, value, embedImages, pipeTables, frontMatter);
    }

    public RenderConfig withEmbedImages(boolean value) {
        return new RenderConfig(formats, calloutsEnabled, calloutTokens, value, pipeTables, frontMatter);
    }

    public RenderConfig withPipeTables(boolean value) {
        return new RenderConfig(formats, calloutsEnabled, calloutTokens, embedImages, value, frontMatter);
    }

    public RenderConfig withFrontMatter(FrontMatter value) {
        return new RenderConfig(formats, calloutsEnabled, calloutTokens, embedImages, pipeTables, Optional.ofNullable(value));
    }
}
