package json.java17.toon;

import java.util.Objects;

/// Immutable options for {@link Toon#encode(json.java17.JsonValue, EncodeOptions)}.
///
/// @param delimiter separator for primitive arrays, tabular rows and header field lists
/// @param lengthMarker character written before array lengths (`[#3]`), or `null` for none
/// @param indent the text written once per nesting level; a non-empty run of spaces
public record EncodeOptions(Delimiter delimiter, Character lengthMarker, String indent) {

    /// Two spaces per level.
    public static final String DEFAULT_INDENT = "  ";

    private static final EncodeOptions DEFAULTS = new EncodeOptions(Delimiter.COMMA, null, DEFAULT_INDENT);

    public EncodeOptions {
        Objects.requireNonNull(delimiter, "delimiter must not be null");
        Objects.requireNonNull(indent, "indent must not be null");
        if (indent.isEmpty() || !indent.chars().allMatch(c -> c == ' ')) {
            throw new IllegalArgumentException(
                    "indent must be one or more spaces, was '" + indent.replace("\t", "\\t") + "'");
        }
        if (lengthMarker != null) {
            final char m = lengthMarker;
            if (Character.isDigit(m) || Character.isWhitespace(m) || Character.isISOControl(m)
                    || "\"\\-[]{}:".indexOf(m) >= 0 || Delimiter.fromSymbol(m).isPresent()) {
                throw new IllegalArgumentException(
                        "length marker '" + Delimiter.printable(m) + "' would not read back as a length");
            }
        }
    }

    /// {@return comma delimiter, no length marker, two-space indent}
    public static EncodeOptions defaults() {
        return DEFAULTS;
    }

    public EncodeOptions withDelimiter(Delimiter delimiter) {
        return new EncodeOptions(delimiter, lengthMarker, indent);
    }

    public EncodeOptions withLengthMarker(char marker) {
        return new EncodeOptions(delimiter, marker, indent);
    }

    public EncodeOptions withoutLengthMarker() {
        return new EncodeOptions(delimiter, null, indent);
    }

    public EncodeOptions withIndent(String indent) {
        return new EncodeOptions(delimiter, lengthMarker, indent);
    }

    /// {@return options indenting each level by `count` spaces}
    public EncodeOptions withSpaces(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive, was " + count);
        }
        return withIndent(" ".repeat(count));
    }

    /// {@return the length as written inside an array header, including the marker}
    public String formatLength(int length) {
        return lengthMarker == null ? Integer.toString(length) : lengthMarker + Integer.toString(length);
    }
}
