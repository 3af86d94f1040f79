package ai.courseware.archiver.segment;

import ai.courseware.archiver.document.ContentMarkers;
import ai.courseware.archiver.document.Section;
import ai.courseware.archiver.document.SectionKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitions sanitized HTML into typed sections.
 *
 * <p>A structural pass extracts the outermost elements matched by a prioritized rule table (callout
 * markers, code blocks, tables) and removes them from the working tree; nested matches stay inside
 * their container and each candidate takes the kind of the first rule it matches. The remaining HTML becomes a single
 * leading section whose kind is taken from its opening keyword, defaulting to plain text.
 */
public class SectionSegmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SectionSegmenter.class);

    private final List<StructuralRule> rules;
    private final CodeLanguageDetector languageDetector;
    private final LexicalClassifier lexicalClassifier;

    public SectionSegmenter() {
        this(new CodeLanguageDetector(), new LexicalClassifier());
    }

    public SectionSegmenter(CodeLanguageDetector languageDetector, LexicalClassifier lexicalClassifier) {
        this.languageDetector = Objects.requireNonNull(languageDetector, "languageDetector");
        this.lexicalClassifier = Objects.requireNonNull(lexicalClassifier, "lexicalClassifier");
        this.rules = buildRules();
    }

    private static List<StructuralRule> buildRules() {
        List<StructuralRule> table = new ArrayList<>();
        for (Map.Entry<SectionKind, List<String>> entry : ContentMarkers.calloutMarkers().entrySet()) {
            String selector = entry.getValue().stream()
                    .map(marker -> "[class*=" + marker + "]:not(pre):not(code)")
                    .collect(Collectors.joining(", "));
            table.add(new StructuralRule(selector, entry.getKey()));
        }
        table.add(new StructuralRule("pre", SectionKind.CODE));
        table.add(new StructuralRule("table", SectionKind.TABLE));
        return List.copyOf(table);
    }

    public List<Section> segment(String cleanHtml) {
        if (cleanHtml == null || cleanHtml.isEmpty()) {
            return List.of();
        }
        Document document = Jsoup.parseBodyFragment(cleanHtml);
        document.outputSettings().prettyPrint(false);
        Element body = document.body();

        List<Section> extracted = new ArrayList<>();
        for (Candidate candidate : outermostCandidates(body)) {
            toSection(candidate.kind(), candidate.element()).ifPresent(extracted::add);
        }

        List<Section> sections = new ArrayList<>();
        remainder(body).ifPresent(sections::add);
        sections.addAll(extracted);

        if (sections.isEmpty()) {
            LOGGER.debug("No sections detected; wrapping input as a single text section");
            return List.of(Section.of(SectionKind.TEXT, cleanHtml));
        }
        LOGGER.debug("Segmented content into {} sections", sections.size());
        return List.copyOf(sections);
    }

    /**
     * Collects, in document order, the structural elements not nested inside another structural
     * element, and detaches them from the working tree.
     */
    private List<Candidate> outermostCandidates(Element body) {
        Set<Element> claimed = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Candidate> ordered = new ArrayList<>();
        for (Element element : body.getAllElements()) {
            if (element == body || hasClaimedAncestor(element, body, claimed)) {
                continue;
            }
            matchingRule(element).ifPresent(rule -> {
                claimed.add(element);
                ordered.add(new Candidate(element, rule.kind()));
            });
        }
        ordered.forEach(candidate -> candidate.element().remove());
        return ordered;
    }

    private static boolean hasClaimedAncestor(Element element, Element body, Set<Element> claimed) {
        for (Element parent = element.parent(); parent != null && parent != body; parent = parent.parent()) {
            if (claimed.contains(parent)) {
                return true;
            }
        }
        return false;
    }

    private Optional<StructuralRule> matchingRule(Element element) {
        return rules.stream().filter(rule -> element.is(rule.selector())).findFirst();
    }

    private Optional<Section> toSection(SectionKind kind, Element element) {
        if (!hasContent(element)) {
            return Optional.empty();
        }
        return switch (kind) {
            case CODE -> Optional.of(new Section(kind, element.outerHtml(), languageDetector.detect(element), Optional.empty()));
            case TABLE -> Optional.of(new Section(kind, element.outerHtml(), Optional.empty(), titleOf(element)));
            default -> {
                String content = element.html().strip();
                yield content.isEmpty()
                        ? Optional.empty()
                        : Optional.of(new Section(kind, content, Optional.empty(), titleOf(element)));
            }
        };
    }

    private Optional<Section> remainder(Element body) {
        String html = body.html().strip();
        if (html.isEmpty() || !hasContent(body)) {
            return Optional.empty();
        }
        SectionKind kind = lexicalClassifier.classify(body.text()).orElse(SectionKind.TEXT);
        return Optional.of(Section.of(kind, html));
    }

    private static boolean hasContent(Element element) {
        return element.hasText() || element.selectFirst("img") != null;
    }

    private static Optional<String> titleOf(Element element) {
        String title = element.attr("title");
        if (title.isBlank()) {
            title = element.attr("data-title");
        }
        return title.isBlank() ? Optional.empty() : Optional.of(title.strip());
    }

    private record StructuralRule(String selector, SectionKind kind) {
    }

    private record Candidate(Element element, SectionKind kind) {
    }

}
