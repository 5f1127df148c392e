package json.java17.toon;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/// Decides when a string must be written quoted, and escapes it when it is.
///
/// A string is written bare only if the scanner reads it back as exactly the same
/// string in the same position. Quoted strings escape `\n`, `\r`, `\t`, `"` and `\`;
/// every other character is written as is.
public final class Quoting {

    private static final Set<String> KEYWORDS = Set.of("null", "true", "false");

    /// Optional minus, no leading zero unless the integer part is exactly `0`,
    /// optional fraction, optional exponent.
    private static final Pattern NUMERIC_LITERAL =
            Pattern.compile("-?(?:0|[1-9][0-9]*)(?:\\.[0-9]+)?(?:[eE][+-]?[0-9]+)?");

    private Quoting() {
    }

    /// {@return true if `s` must be quoted when written in `context` of a document using `delimiter`}
    public static boolean needsQuoting(String s, QuotingContext context, Delimiter delimiter) {
        Objects.requireNonNull(s, "s must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(delimiter, "delimiter must not be null");
        if (s.isEmpty()) {
            return true;
        }
        if (Character.isWhitespace(s.charAt(0)) || Character.isWhitespace(s.charAt(s.length() - 1))) {
            return true;
        }
        if (isLiteralLike(s) || ToonScanner.readsAsNumber(s)) {
            return true;
        }
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '[', ']', '{', '}', ':', '"', '\\' -> {
                    return true;
                }
                default -> {
                    if (c == delimiter.symbol() || Character.isISOControl(c)) {
                        return true;
                    }
                }
            }
        }
        if (s.startsWith("- ")) {
            return true;
        }
        return context == QuotingContext.VALUE && s.equals("-");
    }

    /// {@return `s` unchanged if it can be written bare in `context`, otherwise quoted}
    public static String format(String s, QuotingContext context, Delimiter delimiter) {
        return needsQuoting(s, context, delimiter) ? quote(s) : s;
    }

    /// {@return `s` escaped and wrapped in double quotes}
    public static String quote(String s) {
        return '"' + escape(s) + '"';
    }

    /// {@return `s` with `\n`, `\r`, `\t`, `"` and `\` replaced by their backslash escapes}
    public static String escape(String s) {
        Objects.requireNonNull(s, "s must not be null");
        final var sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /// Reverses {@link #escape(String)}.
    ///
    /// @throws ToonException of kind {@link ToonException.Kind#INVALID_INPUT} for any other
    ///         escape sequence or a trailing lone backslash
    public static String unescape(String s) {
        Objects.requireNonNull(s, "s must not be null");
        final var sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (++i >= s.length()) {
                throw ToonException.invalidInput("unterminated escape sequence at index " + (i - 1));
            }
            final char e = s.charAt(i);
            switch (e) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                default -> throw ToonException.invalidInput(
                        "unsupported escape sequence \\" + Delimiter.printable(e) + " at index " + (i - 1));
            }
        }
        return sb.toString();
    }

    /// {@return true for `null`, `true` and `false`, case-sensitively}
    public static boolean isKeyword(String s) {
        return KEYWORDS.contains(s);
    }

    /// {@return true if `s` is a number in canonical literal form, such as `0`, `-12`, `3.5` or `1e-7`}
    public static boolean isNumericLike(String s) {
        return NUMERIC_LITERAL.matcher(s).matches();
    }

    /// {@return true if `s` is a keyword or a canonical number literal}
    public static boolean isLiteralLike(String s) {
        return isKeyword(s) || isNumericLike(s);
    }

    /// {@return true if `key` can be written as an object key without quotes}
    public static boolean isValidUnquotedKey(String key, Delimiter delimiter) {
        return !needsQuoting(key, QuotingContext.KEY, delimiter);
    }
}
