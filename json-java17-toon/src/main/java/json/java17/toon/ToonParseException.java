package json.java17.toon;

/// A decode failure tied to a position in the input text.
public class ToonParseException extends ToonException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    /// Creates a {@link Kind#PARSE_ERROR} at the given 1-based position.
    public ToonParseException(String message, int line, int column) {
        this(Kind.PARSE_ERROR, message, line, column);
    }

    public ToonParseException(Kind kind, String message, int line, int column) {
        super(kind, formatMessage(message, line, column));
        this.line = line;
        this.column = column;
    }

    private ToonParseException(int expected, int found, int line, int column) {
        super(Kind.LENGTH_MISMATCH, formatMessage(lengthMismatchMessage(expected, found), line, column),
                null, expected, found);
        this.line = line;
        this.column = column;
    }

    /// A {@link Kind#LENGTH_MISMATCH} for the array whose header opens at the given position.
    static ToonParseException lengthMismatch(int expected, int found, int line, int column) {
        return new ToonParseException(expected, found, line, column);
    }

    /// Returns the 1-based line of the failure.
    public int line() {
        return line;
    }

    /// Returns the 1-based column of the failure.
    public int column() {
        return column;
    }

    private static String formatMessage(String message, int line, int column) {
        return message + " at line " + line + ", column " + column;
    }
}
