package json.java17.toon;

import json.java17.JsonArray;
import json.java17.JsonObject;
import json.java17.JsonValue;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Writes a normalized tree, choosing each array's layout with {@link ArrayShape}.
///
/// Layout:
/// ```
/// user:
///   name: Ada
///   tags[2]: math,code
/// rows[2]{id,name}:
///   1,Ada
///   2,Alan
/// mixed[3]:
///   - 1
///   - [2]: a,b
///   - id: 3
///     name: Grace
/// ```
/// An object list item puts its first entry on the dash line and the rest one level
/// deeper than the dash; the first entry's own body goes two levels deeper.
final class ToonEncoder {

    private static final Logger LOG = Logger.getLogger(ToonEncoder.class.getName());

    /// Where the first line of an entry goes: its indentation level and what precedes it.
    private record Lead(int level, String prefix) {
        static Lead at(int level) {
            return new Lead(level, "");
        }

        static Lead dash(int level) {
            return new Lead(level, "- ");
        }
    }

    private final ToonWriter writer;

    private ToonEncoder(EncodeOptions options) {
        this.writer = new ToonWriter(options);
    }

    /// Encodes an already normalized value.
    static String encode(JsonValue value, EncodeOptions options) {
        final ToonEncoder encoder = new ToonEncoder(options);
        encoder.writeRoot(value);
        return encoder.writer.finish();
    }

    private void writeRoot(JsonValue value) {
        if (value instanceof JsonObject obj) {
            Validation.validateDepth(1);
            writeEntries(obj.members(), 0, 1);
        } else if (value instanceof JsonArray arr) {
            writeArray("", arr, 0, Lead.at(0), 1);
        } else {
            writer.line(0, writer.scalar(value));
        }
    }

    private void emit(Lead lead, String content) {
        writer.line(lead.level(), lead.prefix() + content);
    }

    private void writeEntries(Map<String, JsonValue> members, int level, int depth) {
        members.forEach((k, v) -> writeEntry(k, v, level, Lead.at(level), depth));
    }

    /// Writes `key` and its value; nested bodies go to `level + 1`.
    /// `depth` counts the containers enclosing the entry.
    private void writeEntry(String key, JsonValue value, int level, Lead lead, int depth) {
        final String k = writer.key(key);
        if (value instanceof JsonArray arr) {
            writeArray(k, arr, level, lead, depth + 1);
        } else if (value instanceof JsonObject obj) {
            Validation.validateDepth(depth + 1);
            emit(lead, k + ":");
            writeEntries(obj.members(), level + 1, depth + 1);
        } else {
            emit(lead, k + ": " + writer.scalar(value));
        }
    }

    private void writeArray(String key, JsonArray arr, int level, Lead lead, int depth) {
        Validation.validateDepth(depth);
        final List<JsonValue> elements = arr.elements();
        final ArrayShape shape = ArrayShape.classify(arr);
        switch (shape) {
            case EMPTY -> emit(lead, writer.header(key, 0, null));
            case PRIMITIVE -> emit(lead, writer.header(key, elements.size(), null) + " " + writer.row(elements));
            case TABULAR -> {
                final List<String> fields = ArrayShape.tabularFields(elements);
                Validation.validateDepth(depth + 1);
                emit(lead, writer.header(key, elements.size(), fields));
                for (JsonValue element : elements) {
                    writer.line(level + 1, writer.row(((JsonObject) element).members().values()));
                }
            }
            case NESTED -> {
                emit(lead, writer.header(key, elements.size(), null));
                for (JsonValue element : elements) {
                    writeListItem(element, level + 1, depth);
                }
            }
        }
    }

    private void writeListItem(JsonValue element, int level, int depth) {
        if (element instanceof JsonArray inner) {
            writeArray("", inner, level, Lead.dash(level), depth + 1);
        } else if (element instanceof JsonObject obj) {
            Validation.validateDepth(depth + 1);
            if (obj.members().isEmpty()) {
                writer.line(level, "-");
                return;
            }
            final Iterator<Map.Entry<String, JsonValue>> it = obj.members().entrySet().iterator();
            final Map.Entry<String, JsonValue> first = it.next();
            writeEntry(first.getKey(), first.getValue(), level + 1, Lead.dash(level), depth + 1);
            while (it.hasNext()) {
                final Map.Entry<String, JsonValue> e = it.next();
                writeEntry(e.getKey(), e.getValue(), level + 1, Lead.at(level + 1), depth + 1);
            }
        } else {
            writer.line(level, "- " + writer.scalar(element));
        }
        LOG.finest(() -> "Wrote list item at level " + level);
    }
}
