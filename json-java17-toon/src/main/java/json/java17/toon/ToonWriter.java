package json.java17.toon;

import json.java17.JsonBoolean;
import json.java17.JsonNull;
import json.java17.JsonNumber;
import json.java17.JsonString;
import json.java17.JsonValue;

import java.math.BigDecimal;
import java.util.List;

/// Line buffer and token formatting for one encode call.
///
/// Lines are joined with `\n`; the output has no trailing newline.
final class ToonWriter {

    private final EncodeOptions options;
    private final StringBuilder out = new StringBuilder();
    private boolean empty = true;

    ToonWriter(EncodeOptions options) {
        this.options = options;
    }

    /// Appends a line indented `level` times.
    void line(int level, String content) {
        if (!empty) {
            out.append('\n');
        }
        empty = false;
        for (int i = 0; i < level; i++) {
            out.append(options.indent());
        }
        out.append(content);
    }

    String finish() {
        return out.toString();
    }

    String key(String key) {
        return Quoting.format(key, QuotingContext.KEY, options.delimiter());
    }

    /// {@return `key[<marker>N<delimiter>]{fields}:`} `key` is already formatted and may be empty.
    String header(String key, int length, List<String> fields) {
        final var sb = new StringBuilder(key)
                .append('[')
                .append(options.formatLength(length))
                .append(options.delimiter().headerSymbol())
                .append(']');
        if (fields != null) {
            sb.append('{');
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) {
                    sb.append(options.delimiter().symbol());
                }
                sb.append(Quoting.format(fields.get(i), QuotingContext.HEADER, options.delimiter()));
            }
            sb.append('}');
        }
        return sb.append(':').toString();
    }

    /// {@return the primitives formatted as values and joined by the delimiter}
    String row(Iterable<JsonValue> values) {
        final var sb = new StringBuilder();
        for (JsonValue v : values) {
            if (sb.length() > 0) {
                sb.append(options.delimiter().symbol());
            }
            sb.append(scalar(v));
        }
        return sb.toString();
    }

    /// {@return the text of a primitive in value position}
    String scalar(JsonValue value) {
        if (value instanceof JsonString s) {
            return Quoting.format(s.string(), QuotingContext.VALUE, options.delimiter());
        }
        if (value instanceof JsonNumber n) {
            return number(n);
        }
        if (value instanceof JsonBoolean b) {
            return b.bool() ? "true" : "false";
        }
        if (value instanceof JsonNull) {
            return "null";
        }
        throw new IllegalArgumentException("not a primitive: " + value);
    }

    // Keeps the lexical form when it scans back as a number; otherwise writes
    // the plain decimal form (`.5` becomes `0.5`).
    private static String number(JsonNumber n) {
        final String text = n.toString();
        if (ToonScanner.readsAsNumber(text)) {
            return text;
        }
        return new BigDecimal(text).toString();
    }
}
