package json.java17.toon;

/// Immutable options for {@link Toon#decode(String, DecodeOptions)}.
///
/// @param delimiter the pinned document delimiter, or `null` to take it from the first array header
/// @param strict enforce declared array lengths, non-empty field names and indentation
///        in whole multiples of the document's indent unit
/// @param coerceTypes read unquoted numerals that are not in canonical form (`007`, `1.`) as
///        numbers; when false they stay strings. Keywords and canonical numerals are typed either way.
public record DecodeOptions(Delimiter delimiter, boolean strict, boolean coerceTypes) {

    private static final DecodeOptions DEFAULTS = new DecodeOptions(null, true, true);

    /// {@return auto-detected delimiter, strict, coercing}
    public static DecodeOptions defaults() {
        return DEFAULTS;
    }

    /// {@return the defaults with strict checks on}
    public static DecodeOptions strictMode() {
        return DEFAULTS.withStrict(true);
    }

    /// {@return the defaults with coercion of non-canonical numerals off}
    public static DecodeOptions noCoerce() {
        return DEFAULTS.withCoerceTypes(false);
    }

    public DecodeOptions withDelimiter(Delimiter delimiter) {
        return new DecodeOptions(delimiter, strict, coerceTypes);
    }

    public DecodeOptions withStrict(boolean strict) {
        return new DecodeOptions(delimiter, strict, coerceTypes);
    }

    public DecodeOptions withCoerceTypes(boolean coerceTypes) {
        return new DecodeOptions(delimiter, strict, coerceTypes);
    }
}
