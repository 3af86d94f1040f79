package ai.courseware.archiver.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class CookieFileParserTest {

    private final CookieFileParser parser = new CookieFileParser();

    @Test
    void joinsCookiesForMatchingDomain() {
        String content = String.join("\n",
                "# Netscape HTTP Cookie File",
                "",
                ".hackthebox.com\tTRUE\t/\tTRUE\t1999999999\tcf_clearance\tabc",
                "#HttpOnly_academy.hackthebox.com\tFALSE\t/\tTRUE\t0\thtb_academy_session\tsess%3D1",
                "example.org\tFALSE\t/\tFALSE\t0\tforeign\tnope",
                "broken line");

        String header = parser.parse(content, "academy.hackthebox.com");

        assertThat(header).isEqualTo("cf_clearance=abc; htb_academy_session=sess%3D1");
    }

    @Test
    void laterDuplicatesReplaceEarlierValues() {
        String content = "academy.hackthebox.com\tFALSE\t/\tTRUE\t0\ts\told\n"
                + "academy.hackthebox.com\tFALSE\t/\tTRUE\t0\ts\tnew\n";

        assertThat(parser.parse(content, "academy.hackthebox.com")).isEqualTo("s=new");
    }

    @Test
    void failsWhenNoCookieApplies() {
        assertThatThrownBy(() -> parser.parse("example.org\tFALSE\t/\tFALSE\t0\ta\tb", "academy.hackthebox.com"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("academy.hackthebox.com");
    }
}
