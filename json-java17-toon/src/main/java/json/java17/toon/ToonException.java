package json.java17.toon;

/// Unchecked exception for every encode and decode failure.
///
/// {@link #kind()} classifies the failure. Decoding never returns a partial value and
/// encoding never returns partial text.
public class ToonException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// Failure categories.
    public enum Kind {
        INVALID_INPUT,
        PARSE_ERROR,
        INVALID_CHARACTER,
        UNEXPECTED_EOF,
        TYPE_MISMATCH,
        INVALID_DELIMITER,
        LENGTH_MISMATCH,
        INVALID_STRUCTURE,
        SERIALIZATION,
        DESERIALIZATION
    }

    private final Kind kind;
    private final int expected;
    private final int found;

    public ToonException(Kind kind, String message) {
        this(kind, message, null);
    }

    public ToonException(Kind kind, String message, Throwable cause) {
        this(kind, message, cause, -1, -1);
    }

    protected ToonException(Kind kind, String message, Throwable cause, int expected, int found) {
        super(message, cause);
        this.kind = kind;
        this.expected = expected;
        this.found = found;
    }

    public Kind kind() {
        return kind;
    }

    /// {@return the declared array length of a length mismatch, otherwise -1}
    public int expected() {
        return expected;
    }

    /// {@return the counted array length of a length mismatch, otherwise -1}
    public int found() {
        return found;
    }

    static ToonException invalidInput(String message) {
        return new ToonException(Kind.INVALID_INPUT, "Invalid input: " + message);
    }

    static ToonException typeMismatch(String expected, String found) {
        return new ToonException(Kind.TYPE_MISMATCH, "Type mismatch: expected %s, found %s".formatted(expected, found));
    }

    static ToonException invalidDelimiter(String message) {
        return new ToonException(Kind.INVALID_DELIMITER, "Invalid delimiter: " + message);
    }

    static ToonException lengthMismatch(int expected, int found) {
        return new ToonException(Kind.LENGTH_MISMATCH, lengthMismatchMessage(expected, found), null, expected, found);
    }

    static String lengthMismatchMessage(int expected, int found) {
        return "Array length mismatch: expected %d, found %d".formatted(expected, found);
    }

    static ToonException invalidStructure(String message) {
        return new ToonException(Kind.INVALID_STRUCTURE, "Invalid structure: " + message);
    }

    static ToonException serialization(String message, Throwable cause) {
        return new ToonException(Kind.SERIALIZATION, "Serialization error: " + message, cause);
    }

    static ToonException deserialization(String message, Throwable cause) {
        return new ToonException(Kind.DESERIALIZATION, "Deserialization error: " + message, cause);
    }
}
