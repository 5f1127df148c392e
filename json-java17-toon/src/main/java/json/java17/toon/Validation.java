package json.java17.toon;

import json.java17.JsonArray;
import json.java17.JsonObject;
import json.java17.JsonValue;

/// Structural checks shared by the encoder and the parser.
public final class Validation {

    /// Maximum nesting of objects and arrays combined. The root container is at depth 1.
    public static final int MAX_DEPTH = 256;

    private Validation() {
    }

    /// @throws ToonException of kind {@link ToonException.Kind#INVALID_STRUCTURE} if `depth` exceeds {@link #MAX_DEPTH}
    public static void validateDepth(int depth) {
        if (depth > MAX_DEPTH) {
            throw ToonException.invalidStructure("Maximum nesting depth of " + MAX_DEPTH + " exceeded");
        }
    }

    /// @throws ToonException of kind {@link ToonException.Kind#INVALID_STRUCTURE} if `name` is empty
    public static void validateFieldName(String name) {
        if (name.isEmpty()) {
            throw ToonException.invalidStructure("Field name cannot be empty");
        }
    }

    /// @throws ToonException of kind {@link ToonException.Kind#LENGTH_MISMATCH} if the counts differ
    public static void validateLength(int expected, int found) {
        if (expected != found) {
            throw ToonException.lengthMismatch(expected, found);
        }
    }

    /// As {@link #validateLength(int, int)}, reporting the position of the array header.
    /// @throws ToonParseException of kind {@link ToonException.Kind#LENGTH_MISMATCH} if the counts differ
    static void validateLength(int expected, int found, int line, int column) {
        if (expected != found) {
            throw ToonParseException.lengthMismatch(expected, found, line, column);
        }
    }

    /// Checks that `value` nests no deeper than {@link #MAX_DEPTH}.
    /// Stops descending at the first container past the limit, so a hostile tree
    /// cannot exhaust the stack here.
    public static void validateValue(JsonValue value) {
        validateValue(value, 0);
    }

    private static void validateValue(JsonValue value, int depth) {
        if (value instanceof JsonObject obj) {
            validateDepth(depth + 1);
            for (JsonValue member : obj.members().values()) {
                validateValue(member, depth + 1);
            }
        } else if (value instanceof JsonArray arr) {
            validateDepth(depth + 1);
            for (JsonValue element : arr.elements()) {
                validateValue(element, depth + 1);
            }
        }
    }
}
