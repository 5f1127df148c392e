package json.java17.toon;

import java.util.Optional;

/// The character separating sibling values in a primitive array and cells in a tabular row.
///
/// A document uses a single delimiter. Array headers declare it after the length
/// (`[3|]`, `[3\t]`) unless it is the default comma.
public enum Delimiter {
    COMMA(','),
    TAB('\t'),
    PIPE('|');

    private final char symbol;

    Delimiter(char symbol) {
        this.symbol = symbol;
    }

    /// {@return the separator character}
    public char symbol() {
        return symbol;
    }

    /// {@return the text written inside an array header's brackets after the length}
    /// Empty for the default comma.
    public String headerSymbol() {
        return this == COMMA ? "" : String.valueOf(symbol);
    }

    /// {@return true if `s` contains this delimiter's character}
    public boolean containedIn(String s) {
        return s.indexOf(symbol) >= 0;
    }

    /// {@return the delimiter written as `c`, or empty if `c` is not a delimiter}
    public static Optional<Delimiter> fromSymbol(char c) {
        for (Delimiter d : values()) {
            if (d.symbol == c) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }

    /// {@return the delimiter written as `c`}
    /// @throws ToonException of kind {@link ToonException.Kind#INVALID_DELIMITER} for any other character
    public static Delimiter of(char c) {
        return fromSymbol(c).orElseThrow(() -> ToonException.invalidDelimiter(
                "'%s' is not one of ',', '|' or tab".formatted(printable(c))));
    }

    static String printable(char c) {
        return switch (c) {
            case '\t' -> "\\t";
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            default -> Character.isISOControl(c) ? "U+%04X".formatted((int) c) : String.valueOf(c);
        };
    }
}
