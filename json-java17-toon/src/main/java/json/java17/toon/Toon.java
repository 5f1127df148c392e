package json.java17.toon;

import json.java17.JsonArray;
import json.java17.JsonBoolean;
import json.java17.JsonNull;
import json.java17.JsonNumber;
import json.java17.JsonObject;
import json.java17.JsonString;
import json.java17.JsonValue;

import java.util.Objects;
import java.util.logging.Logger;

/// Entry points for encoding trees to TOON text and decoding them back.
///
/// ## Example
/// ```java
/// JsonValue users = Json.fromUntyped(Map.of("users", List.of(
///         Map.of("id", 1, "name", "Alice"),
///         Map.of("id", 2, "name", "Bob"))));
/// String text = Toon.encode(users);
/// // users[2]{id,name}:
/// //   1,Alice
/// //   2,Bob
/// JsonValue back = Toon.decode(text);
/// ```
///
/// Every method is stateless and safe to call from any number of threads.
/// Failures are reported as {@link ToonException}.
public final class Toon {

    private static final Logger LOG = Logger.getLogger(Toon.class.getName());

    private Toon() {
    }

    /// Encodes with {@link EncodeOptions#defaults()}.
    public static String encode(JsonValue value) {
        return encode(value, EncodeOptions.defaults());
    }

    /// Encodes `value` after normalizing it: `NaN` and infinities become `null`, `-0` becomes `0`.
    ///
    /// @throws ToonException of kind {@link ToonException.Kind#INVALID_STRUCTURE} if the tree
    ///         nests deeper than {@link Validation#MAX_DEPTH}
    public static String encode(JsonValue value, EncodeOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(options, "options must not be null");
        LOG.fine(() -> "Encoding " + typeName(value) + " with " + options);
        Validation.validateValue(value);
        final String text = ToonEncoder.encode(Normalizer.normalize(value), options);
        LOG.finer(() -> "Encoded " + text.length() + " chars");
        return text;
    }

    /// Encodes a root object.
    /// @throws ToonException of kind {@link ToonException.Kind#TYPE_MISMATCH} if `value` is not an object
    public static String encodeObject(JsonValue value, EncodeOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        if (!(value instanceof JsonObject)) {
            throw ToonException.typeMismatch("object", typeName(value));
        }
        return encode(value, options);
    }

    /// Encodes a root array.
    /// @throws ToonException of kind {@link ToonException.Kind#TYPE_MISMATCH} if `value` is not an array
    public static String encodeArray(JsonValue value, EncodeOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        if (!(value instanceof JsonArray)) {
            throw ToonException.typeMismatch("array", typeName(value));
        }
        return encode(value, options);
    }

    /// Decodes with {@link DecodeOptions#defaults()}.
    public static JsonValue decode(String text) {
        return decode(text, DecodeOptions.defaults());
    }

    /// Decodes one document. Empty or blank text decodes to an empty object.
    public static JsonValue decode(String text, DecodeOptions options) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(options, "options must not be null");
        LOG.fine(() -> "Decoding " + text.length() + " chars with " + options);
        return ToonParser.parse(text, options);
    }

    /// Decodes with strict length, key and indentation checks.
    public static JsonValue decodeStrict(String text) {
        return decode(text, DecodeOptions.strictMode());
    }

    public static JsonValue decodeStrict(String text, DecodeOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        return decode(text, options.withStrict(true));
    }

    /// Decodes keeping non-canonical numerals such as `007` as strings.
    public static JsonValue decodeNoCoerce(String text) {
        return decode(text, DecodeOptions.noCoerce());
    }

    public static JsonValue decodeNoCoerce(String text, DecodeOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        return decode(text, options.withCoerceTypes(false));
    }

    /// Converts `value` with `codec` and encodes the tree.
    ///
    /// @throws ToonException of kind {@link ToonException.Kind#SERIALIZATION} if the codec fails
    public static <T> String encode(T value, TreeCodec<T> codec, EncodeOptions options) {
        Objects.requireNonNull(codec, "codec must not be null");
        final JsonValue tree;
        try {
            tree = codec.toTree(value);
        } catch (ToonException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw ToonException.serialization(String.valueOf(ex.getMessage()), ex);
        }
        if (tree == null) {
            throw ToonException.serialization("codec returned no tree", null);
        }
        return encode(tree, options);
    }

    /// Decodes `text` and converts the tree with `codec`.
    ///
    /// @throws ToonException of kind {@link ToonException.Kind#DESERIALIZATION} if the codec fails
    public static <T> T decode(String text, TreeCodec<T> codec, DecodeOptions options) {
        Objects.requireNonNull(codec, "codec must not be null");
        final JsonValue tree = decode(text, options);
        try {
            return codec.fromTree(tree);
        } catch (ToonException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw ToonException.deserialization(String.valueOf(ex.getMessage()), ex);
        }
    }

    static String typeName(JsonValue value) {
        if (value instanceof JsonObject) {
            return "object";
        } else if (value instanceof JsonArray) {
            return "array";
        } else if (value instanceof JsonString) {
            return "string";
        } else if (value instanceof JsonNumber) {
            return "number";
        } else if (value instanceof JsonBoolean) {
            return "boolean";
        } else if (value instanceof JsonNull) {
            return "null";
        }
        throw new IllegalStateException("unknown value type " + value.getClass());
    }
}
