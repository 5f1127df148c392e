package json.java17.toon;

/// Where a string is written; the rules for leading dashes differ between them.
public enum QuotingContext {
    /// An object key.
    KEY,
    /// A scalar value: object field value, array element, tabular cell or list item.
    VALUE,
    /// A field name in a tabular array header.
    HEADER
}
