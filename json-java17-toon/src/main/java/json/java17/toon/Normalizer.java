package json.java17.toon;

import json.java17.JsonArray;
import json.java17.JsonNull;
import json.java17.JsonNumber;
import json.java17.JsonObject;
import json.java17.JsonValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Canonicalizes a tree before encoding.
///
/// `NaN` and infinities become `null`; any negative zero becomes the integer `0`.
/// Objects and arrays are rebuilt only when a descendant changed.
public final class Normalizer {

    private static final JsonNumber ZERO = JsonNumber.of(0L);

    private Normalizer() {
    }

    /// {@return the normalized form of `value`}
    public static JsonValue normalize(JsonValue value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value instanceof JsonNumber n) {
            return normalizeNumber(n);
        }
        if (value instanceof JsonObject obj) {
            final Map<String, JsonValue> members = new LinkedHashMap<>();
            boolean changed = false;
            for (Map.Entry<String, JsonValue> e : obj.members().entrySet()) {
                final JsonValue v = normalize(e.getValue());
                changed |= v != e.getValue();
                members.put(e.getKey(), v);
            }
            return changed ? JsonObject.of(members) : obj;
        }
        if (value instanceof JsonArray arr) {
            final List<JsonValue> elements = new ArrayList<>(arr.elements().size());
            boolean changed = false;
            for (JsonValue e : arr.elements()) {
                final JsonValue v = normalize(e);
                changed |= v != e;
                elements.add(v);
            }
            return changed ? JsonArray.of(elements) : arr;
        }
        return value;
    }

    private static JsonValue normalizeNumber(JsonNumber n) {
        if (!n.isFinite()) {
            return JsonNull.of();
        }
        final String text = n.toString();
        if (text.startsWith("-") && new BigDecimal(text).signum() == 0) {
            return ZERO;
        }
        return n;
    }
}
