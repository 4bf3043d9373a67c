package io.verdict.server.validation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void shouldReturnNullStringForNullInput() {
        assertThat(LogSanitizer.sanitize(null)).isEqualTo("null");
    }

    @Test
    void shouldReturnCleanStringUnchanged() {
        assertThat(LogSanitizer.sanitize("page:intro")).isEqualTo("page:intro");
    }

    @Test
    void shouldStripNewlineFromForgedReasoning() {
        assertThat(LogSanitizer.sanitize("looks fine\nINFO Session archived: session=ws-1"))
                .isEqualTo("looks fineINFO Session archived: session=ws-1");
    }

    @Test
    void shouldStripCrLfSequence() {
        assertThat(LogSanitizer.sanitize("line1\r\nline2")).isEqualTo("line1line2");
    }

    @Test
    void shouldAbbreviateLongText() {
        assertThat(LogSanitizer.abbreviate("abcdefghij", 4)).isEqualTo("abcd...");
    }

    @Test
    void shouldNotAbbreviateShortText() {
        assertThat(LogSanitizer.abbreviate("abc\n", 4)).isEqualTo("abc");
    }
}
