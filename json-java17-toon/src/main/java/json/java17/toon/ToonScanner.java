package json.java17.toon;

import java.util.logging.Logger;

/// Pull-based tokenizer over a whole document.
///
/// Spaces separate tokens and are otherwise dropped. For each token the scanner
/// records its line and column, the indentation of its line, and how many spaces
/// preceded it, so the parser can track nesting and rebuild multi-word scalars.
///
/// The active delimiter is request scoped: until the parser calls
/// {@link #setActiveDelimiter(Delimiter)} every `,` `|` and tab is ordinary text.
final class ToonScanner {

    private static final Logger LOG = Logger.getLogger(ToonScanner.class.getName());

    private final String input;
    private Delimiter activeDelimiter;

    private int pos;
    private int line = 1;
    private int column = 1;
    private boolean atLineStart = true;
    private int lineIndent;

    // position of the last token returned
    private int tokenLine = 1;
    private int tokenColumn = 1;
    private int tokenIndent;
    private int tokenGap;
    private boolean tokenStartsLine;

    ToonScanner(String input, Delimiter activeDelimiter) {
        this.input = input;
        this.activeDelimiter = activeDelimiter;
    }

    void setActiveDelimiter(Delimiter delimiter) {
        LOG.finer(() -> "Active delimiter set to " + delimiter);
        this.activeDelimiter = delimiter;
    }

    Delimiter activeDelimiter() {
        return activeDelimiter;
    }

    int line() {
        return tokenLine;
    }

    int column() {
        return tokenColumn;
    }

    /// {@return the number of leading spaces on the line of the last token}
    int indent() {
        return tokenIndent;
    }

    /// {@return the number of spaces between the previous token and the last token}
    int gap() {
        return tokenGap;
    }

    /// {@return true if the last token is the first one on its line}
    boolean startsLine() {
        return tokenStartsLine;
    }

    /// Cursor snapshot for bounded lookahead. The active delimiter is not part of it.
    record State(int pos, int line, int column, boolean atLineStart, int lineIndent,
                 int tokenLine, int tokenColumn, int tokenIndent, int tokenGap,
                 boolean tokenStartsLine) {
    }

    State save() {
        return new State(pos, line, column, atLineStart, lineIndent,
                tokenLine, tokenColumn, tokenIndent, tokenGap, tokenStartsLine);
    }

    void restore(State s) {
        pos = s.pos();
        line = s.line();
        column = s.column();
        atLineStart = s.atLineStart();
        lineIndent = s.lineIndent();
        tokenLine = s.tokenLine();
        tokenColumn = s.tokenColumn();
        tokenIndent = s.tokenIndent();
        tokenGap = s.tokenGap();
        tokenStartsLine = s.tokenStartsLine();
    }

    /// Scans the next token.
    /// @throws ToonParseException on an unterminated quoted string or a control character in unquoted text
    Token next() {
        int spaces = 0;
        while (pos < input.length() && input.charAt(pos) == ' ') {
            advance();
            spaces++;
        }
        if (atLineStart) {
            lineIndent = spaces;
        }
        tokenGap = spaces;
        tokenIndent = lineIndent;
        tokenStartsLine = atLineStart;
        tokenLine = line;
        tokenColumn = column;
        atLineStart = false;

        if (pos >= input.length()) {
            return Token.EOF;
        }
        final char c = input.charAt(pos);
        switch (c) {
            case '\n':
                advance();
                atLineStart = true;
                return Token.structural(TokenKind.NEWLINE, "\n");
            case '\r':
                advance();
                if (pos < input.length() && input.charAt(pos) == '\n') {
                    advance();
                }
                atLineStart = true;
                return Token.structural(TokenKind.NEWLINE, "\n");
            case '[':
                advance();
                return Token.structural(TokenKind.LEFT_BRACKET, "[");
            case ']':
                advance();
                return Token.structural(TokenKind.RIGHT_BRACKET, "]");
            case '{':
                advance();
                return Token.structural(TokenKind.LEFT_BRACE, "{");
            case '}':
                advance();
                return Token.structural(TokenKind.RIGHT_BRACE, "}");
            case ':':
                advance();
                return Token.structural(TokenKind.COLON, ":");
            case '"':
                return scanQuoted();
            case '-': {
                final char after = pos + 1 < input.length() ? input.charAt(pos + 1) : '\n';
                if (isDigit(after)) {
                    return scanNumeric();
                }
                if (after == ' ' || after == '\n' || after == '\r') {
                    advance();
                    return Token.structural(TokenKind.DASH, "-");
                }
                return scanUnquoted();
            }
            default:
                if (isDigit(c)) {
                    return scanNumeric();
                }
                if (activeDelimiter != null && c == activeDelimiter.symbol()) {
                    advance();
                    return Token.delimiter(activeDelimiter);
                }
                return scanUnquoted();
        }
    }

    private Token scanQuoted() {
        final int start = pos;
        final int startLine = line;
        final int startColumn = column;
        advance(); // opening quote
        final var sb = new StringBuilder();
        while (pos < input.length()) {
            final char c = input.charAt(pos);
            advance();
            if (c == '"') {
                return Token.quoted(sb.toString(), input.substring(start, pos));
            }
            if (c == '\\') {
                if (pos >= input.length()) {
                    break;
                }
                final char e = input.charAt(pos);
                advance();
                switch (e) {
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    default -> sb.append('\\').append(e);
                }
            } else {
                sb.append(c);
            }
        }
        throw new ToonParseException(ToonException.Kind.UNEXPECTED_EOF,
                "Unexpected end of input in quoted string", startLine, startColumn);
    }

    private Token scanNumeric() {
        int end = pos;
        if (input.charAt(end) == '-') {
            end++;
        }
        while (end < input.length() && isNumberChar(input.charAt(end))) {
            end++;
        }
        if (end < input.length() && !isBoundary(input.charAt(end))) {
            // digits run into text, e.g. 5x or 2024-01-01T10
            return scanUnquoted();
        }
        final String raw = input.substring(pos, end);
        while (pos < end) {
            advance();
        }
        return numericToken(raw);
    }

    private Token scanUnquoted() {
        final int start = pos;
        while (pos < input.length()) {
            final char c = input.charAt(pos);
            if (isBoundary(c)) {
                break;
            }
            if (c != '\t' && Character.isISOControl(c)) {
                throw new ToonParseException(ToonException.Kind.INVALID_CHARACTER,
                        "Invalid character %s at position %d".formatted(Delimiter.printable(c), pos), line, column);
            }
            advance();
        }
        final String raw = input.substring(start, pos);
        return switch (raw) {
            case "null" -> Token.nullToken();
            case "true", "false" -> Token.bool(raw);
            default -> Token.unquoted(raw);
        };
    }

    private boolean isBoundary(char c) {
        return switch (c) {
            case '[', ']', '{', '}', ':', '\n', '\r', ' ' -> true;
            default -> activeDelimiter != null && c == activeDelimiter.symbol();
        };
    }

    private void advance() {
        if (input.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    /// Classifies a run of number characters the way the scanner reads it back.
    ///
    /// @return an `INTEGER` token if `raw` parses as a `long` and has no fraction or exponent,
    ///         else a `NUMBER` token if it parses as a `double`, else an unquoted `STRING` token
    static Token numericToken(String raw) {
        final boolean decimal = raw.indexOf('.') >= 0 || raw.indexOf('e') >= 0 || raw.indexOf('E') >= 0;
        if (!decimal) {
            try {
                return Token.integer(raw, Long.parseLong(raw));
            } catch (NumberFormatException ignored) {
                // too large for a long, try a double
            }
        }
        try {
            return Token.number(raw, Double.parseDouble(raw));
        } catch (NumberFormatException ex) {
            return Token.unquoted(raw);
        }
    }

    /// {@return true if unquoted `s` would be scanned as one `INTEGER` or `NUMBER` token}
    static boolean readsAsNumber(String s) {
        if (s.isEmpty()) {
            return false;
        }
        final int first = s.charAt(0) == '-' ? 1 : 0;
        if (first >= s.length() || !isDigit(s.charAt(first))) {
            return false;
        }
        for (int i = first; i < s.length(); i++) {
            if (!isNumberChar(s.charAt(i))) {
                return false;
            }
        }
        return numericToken(s).kind() != TokenKind.STRING;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNumberChar(char c) {
        return isDigit(c) || c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-';
    }
}
