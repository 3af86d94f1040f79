package ai.courseware.archiver.run;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.courseware.archiver.render.RenderConfig;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class RunValidatorTest {

    private static final String COOKIES = "htb_academy_session=abc%3D123; XSRF-TOKEN=x.y";
    private static final String URL = "https://academy.hackthebox.com/module/77/section/725";

    private final RunValidator validator = new RunValidator();

    @Test
    void acceptsValidInput() {
        List<URI> urls = validator.validate(List.of(URL), RunConfig.defaults(COOKIES, "out"));

        assertThat(urls).containsExactly(URI.create(URL));
    }

    @Test
    void rejectsMalformedCookieHeader() {
        assertField(List.of(URL), RunConfig.defaults("htb_academy_session=abc;other=1", "out"), "cookies");
        assertField(List.of(URL), RunConfig.defaults("htb_academy_session=a b", "out"), "cookies");
        assertField(List.of(URL), RunConfig.defaults("", "out"), "cookies");
    }

    @Test
    void requiresSessionCookie() {
        assertThatThrownBy(() -> validator.validate(List.of(URL), RunConfig.defaults("other=1", "out")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("htb_academy_session");
    }

    @Test
    void honorsConfiguredSessionCookieName() {
        RunConfig config = RunConfig.defaults("sid=1", "out").withSessionCookieName("sid");

        assertThat(validator.validate(List.of(URL), config)).hasSize(1);
    }

    @Test
    void rejectsForeignOrRelativeUrls() {
        RunConfig config = RunConfig.defaults(COOKIES, "out");

        assertField(List.of("https://evil.example/module/1"), config, "urls");
        assertField(List.of("/module/1/section/2"), config, "urls");
        assertField(List.of("ftp://academy.hackthebox.com/x"), config, "urls");
        assertField(List.of(), config, "urls");
    }

    @Test
    void rejectsTraversingOutputDirectory() {
        assertField(List.of(URL), RunConfig.defaults(COOKIES, "notes/../../etc"), "outputDirectory");
        assertField(List.of(URL), RunConfig.defaults(COOKIES, " "), "outputDirectory");
    }

    @Test
    void rejectsInvalidLimits() {
        RunConfig base = RunConfig.defaults(COOKIES, "out");

        assertField(List.of(URL), base.withRateLimit(Duration.ofSeconds(-1)), "rateLimit");
        assertField(List.of(URL), base.withMaxConsecutiveFailures(0), "maxConsecutiveFailures");
    }

    @Test
    void defaultsToMarkdownWhenNoFormatIsGiven() {
        RunConfig config = RunConfig.defaults(COOKIES, "out").withRenderConfig(RenderConfig.defaults().withFormats(null));

        assertThat(validator.validate(List.of(URL), config)).hasSize(1);
        assertThat(config.renderConfig().formats()).isNotEmpty();
    }

    private void assertField(List<String> urls, RunConfig config, String field) {
        assertThatThrownBy(() -> validator.validate(urls, config))
                .isInstanceOfSatisfying(ValidationException.class, ex -> assertThat(ex.field()).isEqualTo(field));
    }
}
