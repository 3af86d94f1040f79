package ai.courseware.archiver.sanitize;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class HtmlSanitizerTest {

    private final HtmlSanitizer sanitizer = new HtmlSanitizer();

    @Test
    void removesScriptAndKeepsParagraph() {
        String clean = sanitizer.sanitize("<div><script>alert(1)</script><p>ok</p></div>");

        assertThat(clean).contains("<p>ok</p>");
        assertThat(clean).doesNotContain("<script");
        assertThat(clean).doesNotContain("alert(1)");
    }

    @Test
    void unwrapsDisallowedTagsWithoutLosingText() {
        String clean = sanitizer.sanitize("<p><span class=\"x\">Hi <b>there</b></span></p>");

        assertThat(clean).isEqualTo("<p>Hi <b>there</b></p>");
    }

    @Test
    void dropsNavigationAndHiddenContent() {
        String clean = sanitizer.sanitize(
                "<nav><a href=\"/home\">Home</a></nav><p hidden>secret</p><p style=\"display: none\">gone</p><p>kept</p>");

        assertThat(clean).isEqualTo("<p>kept</p>");
    }

    @Test
    void promotesMarkedContainersToBlockquotes() {
        String clean = sanitizer.sanitize(
                "<div class=\"alert alert-warning\" title=\"Careful\" id=\"w1\"><p>Watch out</p></div>");

        assertThat(clean).isEqualTo("<blockquote class=\"alert alert-warning\" title=\"Careful\"><p>Watch out</p></blockquote>");
    }

    @Test
    void handsHighlighterClassToPreformattedChild() {
        String clean = sanitizer.sanitize("<div class=\"highlight language-python\"><pre>print(1)</pre></div>");

        assertThat(clean).isEqualTo("<pre class=\"highlight language-python\">print(1)</pre>");
    }

    @Test
    void removesEmptyElementsButKeepsImages() {
        String clean = sanitizer.sanitize("<p></p><p><img src=\"a.png\"></p><ul><li></li></ul>");

        assertThat(clean).isEqualTo("<p><img src=\"a.png\"></p>");
    }

    @Test
    void stripsUnsafeAttributes() {
        String clean = sanitizer.sanitize(
                "<p style=\"color:red\" onclick=\"x()\">T</p><p><a href=\"javascript:alert(1)\" target=\"_blank\">x</a></p>");

        assertThat(clean).isEqualTo("<p>T</p><p><a>x</a></p>");
    }

    @Test
    void returnsEmptyStringForBlankInput() {
        assertThat(sanitizer.sanitize("   ")).isEmpty();
        assertThat(sanitizer.sanitize(null)).isEmpty();
    }

    @Test
    void sanitizingTwiceChangesNothing() {
        List<String> samples = List.of(
                "<div><script>alert(1)</script><p>ok</p></div>",
                "<pre>\n\nline one\n  line two</pre>",
                "<table><tr><th>a</th><th>b</th></tr><tr><td>1</td><td></td></tr></table>",
                "<section class=\"note\"><div class=\"highlight\"><pre>x = 1</pre></div></section>",
                "<ul><li>one<ul><li>nested</li></ul></li><li><em>two</em></li></ul>",
                "<h2 id=\"intro\">Intro</h2><p>Text with <code>code</code> and <a href=\"https://x.test/a\">link</a>.</p>",
                "<article class=\"module-content\"><h3>Title</h3><div><div><p>deep</p></div></div><br><hr></article>",
                "<p>Broken <b>markup <i>here</p> and <span>there");

        for (String sample : samples) {
            String once = sanitizer.sanitize(sample);
            assertThat(sanitizer.sanitize(once)).as(sample).isEqualTo(once);
        }
    }
}
