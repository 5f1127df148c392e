package json.java17.toon;

import json.java17.JsonValue;

import java.util.Objects;
import java.util.function.Function;

/// Converts values of `T` to and from the tree model, for
/// {@link Toon#encode(Object, TreeCodec, EncodeOptions)} and
/// {@link Toon#decode(String, TreeCodec, DecodeOptions)}.
///
/// Implementations report failures with unchecked exceptions; the `Toon` entry
/// points wrap them as serialization or deserialization errors.
public interface TreeCodec<T> {

    JsonValue toTree(T value);

    T fromTree(JsonValue tree);

    /// {@return a codec built from two functions}
    static <T> TreeCodec<T> of(Function<? super T, ? extends JsonValue> toTree,
                               Function<? super JsonValue, ? extends T> fromTree) {
        Objects.requireNonNull(toTree, "toTree must not be null");
        Objects.requireNonNull(fromTree, "fromTree must not be null");
        return new TreeCodec<>() {
            @Override
            public JsonValue toTree(T value) {
                return toTree.apply(value);
            }

            @Override
            public T fromTree(JsonValue tree) {
                return fromTree.apply(tree);
            }
        };
    }
}
