package ai.courseware.archiver.segment;

import static org.assertj.core.api.Assertions.assertThat;

import ai.courseware.archiver.document.Section;
import ai.courseware.archiver.document.SectionKind;
import ai.courseware.archiver.sanitize.HtmlSanitizer;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class SectionSegmenterTest {

    private final SectionSegmenter segmenter = new SectionSegmenter();
    private final HtmlSanitizer sanitizer = new HtmlSanitizer();

    @Test
    void classifiesLeadingWarningKeyword() {
        List<Section> sections = segmenter.segment("<p><strong>Warning:</strong> danger ahead</p>");

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).kind()).isEqualTo(SectionKind.WARNING);
        assertThat(sections.get(0).content()).isEqualTo("<p><strong>Warning:</strong> danger ahead</p>");
    }

    @Test
    void plainProseBecomesTextSection() {
        List<Section> sections = segmenter.segment("<p>Just a paragraph.</p>");

        assertThat(sections).extracting(Section::kind).containsExactly(SectionKind.TEXT);
    }

    @Test
    void extractsStructuralSectionsInDocumentOrder() {
        String html = "<p>Intro</p>"
                + "<blockquote class=\"alert-info\" title=\"Heads up\"><p>Info body</p></blockquote>"
                + "<pre class=\"language-bash\">ls -la</pre>"
                + "<table><tbody><tr><td>a</td></tr></tbody></table>"
                + "<blockquote class=\"exercise\"><p>Try it</p></blockquote>";

        List<Section> sections = segmenter.segment(html);

        assertThat(sections).extracting(Section::kind).containsExactly(
                SectionKind.TEXT, SectionKind.INFO, SectionKind.CODE, SectionKind.TABLE, SectionKind.EXAMPLE);
        assertThat(sections.get(0).content()).isEqualTo("<p>Intro</p>");
        assertThat(sections.get(1).title()).contains("Heads up");
        assertThat(sections.get(1).content()).isEqualTo("<p>Info body</p>");
        assertThat(sections.get(2).language()).contains("bash");
        assertThat(sections.get(3).content()).startsWith("<table>");
    }

    @Test
    void infoMarkerWinsOverLowerPriorityMarkers() {
        List<Section> sections = segmenter.segment("<blockquote class=\"note info\"><p>Both</p></blockquote>");

        assertThat(sections).extracting(Section::kind).containsExactly(SectionKind.INFO);
    }

    @Test
    void codeInsideCalloutStaysWithCallout() {
        List<Section> sections = segmenter.segment(
                "<blockquote class=\"warning\"><p>Careful</p><pre>rm -rf /tmp/x</pre></blockquote>");

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).kind()).isEqualTo(SectionKind.WARNING);
        assertThat(sections.get(0).content()).contains("<pre>rm -rf /tmp/x</pre>");
    }

    @Test
    void calloutInsideTableCellStaysInTable() {
        List<Section> sections = segmenter.segment(
                "<table><tr><td><p class=\"note\">cell note</p></td><td>b</td></tr></table>");

        assertThat(sections).extracting(Section::kind).containsExactly(SectionKind.TABLE);
        assertThat(sections.get(0).content()).contains("<td><p class=\"note\">cell note</p></td>");
    }

    @Test
    void nestedCalloutStaysInsideOuterCallout() {
        List<Section> sections = segmenter.segment(
                "<blockquote class=\"warning\">W text<blockquote class=\"info\">I text</blockquote>more W</blockquote>");

        assertThat(sections).extracting(Section::kind).containsExactly(SectionKind.WARNING);
        assertThat(sections.get(0).content())
                .isEqualTo("W text<blockquote class=\"info\">I text</blockquote>more W");
    }

    @Test
    void dropsEmptyCandidates() {
        List<Section> sections = segmenter.segment("<p>Body</p><blockquote class=\"note\"> </blockquote>");

        assertThat(sections).extracting(Section::kind).containsExactly(SectionKind.TEXT);
    }

    @Test
    void emptyInputYieldsNoSections() {
        assertThat(segmenter.segment("")).isEmpty();
    }

    @Test
    void contentWithoutTextFallsBackToSingleTextSection() {
        List<Section> sections = segmenter.segment("<br>");

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).kind()).isEqualTo(SectionKind.TEXT);
        assertThat(sections.get(0).content()).isEqualTo("<br>");
    }

    @Test
    void segmentsOfSanitizedPagesCarryNoBlocklistedTags() {
        List<String> pages = List.of(
                "<div><script>alert(1)</script><p>ok</p></div>",
                "<div class=\"alert alert-danger\"><style>p{}</style><p>Danger</p></div><nav>menu</nav>",
                "<article><iframe src=\"x\"></iframe><pre><code class=\"lang-js\">let a = 1;</code></pre></article>");

        for (String page : pages) {
            List<Section> sections = segmenter.segment(sanitizer.sanitize(page));
            assertThat(sections).as(page).isNotEmpty();
            String joined = sections.stream().map(Section::content).collect(Collectors.joining());
            assertThat(sanitizer.sanitize(joined)).doesNotContain("<script", "<style", "<nav", "<iframe");
        }
    }
}
