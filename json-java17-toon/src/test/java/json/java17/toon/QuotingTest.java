package json.java17.toon;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuotingTest extends ToonLoggingConfig {

    private static final Logger LOG = Logger.getLogger(QuotingTest.class.getName());

    @ParameterizedTest
    @ValueSource(strings = {"hello", "hello world", "Ada Lovelace", "user_name", "2024-01-01", "a-b", "#tag",
            "你好世界", "😀🎉", "+5", "-x", "1 2"})
    void testSafeStringsStayBare(String s) {
        LOG.info(() -> "TEST: testSafeStringsStayBare " + s);
        assertThat(Quoting.needsQuoting(s, QuotingContext.VALUE, Delimiter.COMMA)).isFalse();
        assertThat(Quoting.format(s, QuotingContext.VALUE, Delimiter.COMMA)).isEqualTo(s);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " lead", "trail ", "true", "false", "null", "42", "-3.5", "1e9", "007", "1.",
            "a:b", "[x]", "{x}", "say \"hi\"", "back\\slash", "a,b", "line\nbreak", "tab\there", "- item", "-"})
    void testAmbiguousValuesAreQuoted(String s) {
        LOG.info(() -> "TEST: testAmbiguousValuesAreQuoted " + s);
        assertThat(Quoting.needsQuoting(s, QuotingContext.VALUE, Delimiter.COMMA)).isTrue();
    }

    @Test
    void testDelimiterOnlyMattersForActiveDelimiter() {
        LOG.info(() -> "TEST: testDelimiterOnlyMattersForActiveDelimiter");
        assertThat(Quoting.needsQuoting("a,b", QuotingContext.VALUE, Delimiter.PIPE)).isFalse();
        assertThat(Quoting.needsQuoting("a|b", QuotingContext.VALUE, Delimiter.PIPE)).isTrue();
        assertThat(Quoting.needsQuoting("a|b", QuotingContext.VALUE, Delimiter.COMMA)).isFalse();
        assertThat(Quoting.needsQuoting("a,b", QuotingContext.HEADER, Delimiter.COMMA)).isTrue();
    }

    @Test
    void testLoneDashIsOnlyQuotedAsValue() {
        LOG.info(() -> "TEST: testLoneDashIsOnlyQuotedAsValue");
        assertThat(Quoting.needsQuoting("-", QuotingContext.VALUE, Delimiter.COMMA)).isTrue();
        assertThat(Quoting.needsQuoting("-", QuotingContext.KEY, Delimiter.COMMA)).isFalse();
    }

    @Test
    void testQuoteEscapesExactlyFiveCharacters() {
        LOG.info(() -> "TEST: testQuoteEscapesExactlyFiveCharacters");
        assertThat(Quoting.quote("a\"b\\c\nd\re\tf")).isEqualTo("\"a\\\"b\\\\c\\nd\\re\\tf\"");
        assertThat(Quoting.escape("\u0001é")).isEqualTo("\u0001é");
    }

    @Test
    void testUnescapeReversesEscape() {
        LOG.info(() -> "TEST: testUnescapeReversesEscape");
        final String s = "quote\" slash\\ nl\n cr\r tab\t";
        assertThat(Quoting.unescape(Quoting.escape(s))).isEqualTo(s);
    }

    @Test
    void testUnescapeRejectsUnknownEscapes() {
        LOG.info(() -> "TEST: testUnescapeRejectsUnknownEscapes");
        assertThatThrownBy(() -> Quoting.unescape("bad\\x"))
                .isInstanceOf(ToonException.class)
                .hasMessageContaining("unsupported escape sequence \\x at index 3")
                .satisfies(e -> assertThat(((ToonException) e).kind()).isEqualTo(ToonException.Kind.INVALID_INPUT));
        assertThatThrownBy(() -> Quoting.unescape("trailing\\"))
                .isInstanceOf(ToonException.class)
                .hasMessageContaining("unterminated escape sequence");
    }

    @Test
    void testLiteralDetection() {
        LOG.info(() -> "TEST: testLiteralDetection");
        assertThat(Quoting.isKeyword("null")).isTrue();
        assertThat(Quoting.isKeyword("Null")).isFalse();
        assertThat(Quoting.isNumericLike("0")).isTrue();
        assertThat(Quoting.isNumericLike("-12.5E+3")).isTrue();
        assertThat(Quoting.isNumericLike("01")).isFalse();
        assertThat(Quoting.isNumericLike("1.")).isFalse();
        assertThat(Quoting.isNumericLike(".5")).isFalse();
        assertThat(Quoting.isLiteralLike("true")).isTrue();
        assertThat(Quoting.isLiteralLike("3")).isTrue();
        assertThat(Quoting.isLiteralLike("three")).isFalse();
    }

    @Test
    void testUnquotedKeys() {
        LOG.info(() -> "TEST: testUnquotedKeys");
        assertThat(Quoting.isValidUnquotedKey("user_name", Delimiter.COMMA)).isTrue();
        assertThat(Quoting.isValidUnquotedKey("first name", Delimiter.COMMA)).isTrue();
        assertThat(Quoting.isValidUnquotedKey("", Delimiter.COMMA)).isFalse();
        assertThat(Quoting.isValidUnquotedKey("a:b", Delimiter.COMMA)).isFalse();
        assertThat(Quoting.isValidUnquotedKey("1", Delimiter.COMMA)).isFalse();
        assertThat(Quoting.isValidUnquotedKey("a|b", Delimiter.PIPE)).isFalse();
    }
}
