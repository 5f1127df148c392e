package json.java17.toon;

/// Kinds of token produced by {@link ToonScanner}.
enum TokenKind {
    LEFT_BRACKET,
    RIGHT_BRACKET,
    LEFT_BRACE,
    RIGHT_BRACE,
    COLON,
    DASH,
    NEWLINE,
    STRING,
    INTEGER,
    NUMBER,
    BOOL,
    NULL,
    DELIMITER,
    EOF;

    /// {@return true for tokens that can make up a scalar or a key}
    boolean isScalar() {
        return switch (this) {
            case STRING, INTEGER, NUMBER, BOOL, NULL -> true;
            case LEFT_BRACKET, RIGHT_BRACKET, LEFT_BRACE, RIGHT_BRACE, COLON, DASH, NEWLINE, DELIMITER, EOF -> false;
        };
    }
}
