package json.java17.toon;

import json.java17.JsonArray;
import json.java17.JsonObject;
import json.java17.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// The layouts an array can be written in, from most to least compact.
public enum ArrayShape {
    /// No elements: a header alone, `items[0]:`.
    EMPTY,
    /// Objects sharing one ordered list of keys, all values primitive:
    /// a header with a field list and one delimited row per element.
    TABULAR,
    /// Primitive elements only: delimited on the header's line.
    PRIMITIVE,
    /// Anything else: one `- ` item per element on following lines.
    NESTED;

    private static final Logger LOG = Logger.getLogger(ArrayShape.class.getName());

    /// {@return the most compact shape that can represent `array`}
    public static ArrayShape classify(JsonArray array) {
        Objects.requireNonNull(array, "array must not be null");
        final List<JsonValue> elements = array.elements();
        final ArrayShape shape;
        if (elements.isEmpty()) {
            shape = EMPTY;
        } else if (tabularFields(elements) != null) {
            shape = TABULAR;
        } else if (elements.stream().allMatch(ArrayShape::isPrimitive)) {
            shape = PRIMITIVE;
        } else {
            shape = NESTED;
        }
        LOG.finest(() -> "Classified array of " + elements.size() + " as " + shape);
        return shape;
    }

    /// {@return the shared field list if `elements` can be written as a table, otherwise `null`}
    /// Rows need at least one field, and no field may be empty.
    static List<String> tabularFields(List<JsonValue> elements) {
        if (elements.isEmpty() || !(elements.get(0) instanceof JsonObject first)) {
            return null;
        }
        final List<String> fields = new ArrayList<>(first.members().keySet());
        if (fields.isEmpty() || fields.contains("")) {
            return null;
        }
        for (JsonValue element : elements) {
            if (!(element instanceof JsonObject row)) {
                return null;
            }
            if (!fields.equals(new ArrayList<>(row.members().keySet()))) {
                return null;
            }
            for (JsonValue cell : row.members().values()) {
                if (!isPrimitive(cell)) {
                    return null;
                }
            }
        }
        return fields;
    }

    /// {@return true for null, booleans, numbers and strings}
    static boolean isPrimitive(JsonValue value) {
        return !(value instanceof JsonObject) && !(value instanceof JsonArray);
    }
}
