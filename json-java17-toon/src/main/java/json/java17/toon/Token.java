package json.java17.toon;

/// A lexical token.
///
/// @param kind the token kind
/// @param raw the exact source text of the token, including quotes for quoted strings
/// @param text the string payload: the unescaped content of a quoted string, otherwise `raw`
/// @param quoted true for a quoted string
/// @param number the `Long` of an `INTEGER` or the `Double` of a `NUMBER`, otherwise `null`
/// @param delimiter the delimiter of a `DELIMITER` token, otherwise `null`
record Token(TokenKind kind, String raw, String text, boolean quoted, Number number, Delimiter delimiter) {

    static final Token EOF = new Token(TokenKind.EOF, "", "", false, null, null);

    static Token structural(TokenKind kind, String raw) {
        return new Token(kind, raw, raw, false, null, null);
    }

    static Token quoted(String value, String raw) {
        return new Token(TokenKind.STRING, raw, value, true, null, null);
    }

    static Token unquoted(String raw) {
        return new Token(TokenKind.STRING, raw, raw, false, null, null);
    }

    static Token integer(String raw, long value) {
        return new Token(TokenKind.INTEGER, raw, raw, false, value, null);
    }

    static Token number(String raw, double value) {
        return new Token(TokenKind.NUMBER, raw, raw, false, value, null);
    }

    static Token bool(String raw) {
        return new Token(TokenKind.BOOL, raw, raw, false, null, null);
    }

    static Token nullToken() {
        return new Token(TokenKind.NULL, "null", "null", false, null, null);
    }

    static Token delimiter(Delimiter d) {
        final String raw = String.valueOf(d.symbol());
        return new Token(TokenKind.DELIMITER, raw, raw, false, null, d);
    }

    boolean is(TokenKind k) {
        return kind == k;
    }

    boolean boolValue() {
        return "true".equals(raw);
    }

    /// {@return how the token reads in messages}
    String describe() {
        return switch (kind) {
            case EOF -> "end of input";
            case NEWLINE -> "end of line";
            case DELIMITER -> "delimiter '" + Delimiter.printable(delimiter.symbol()) + "'";
            default -> "'" + raw + "'";
        };
    }
}
