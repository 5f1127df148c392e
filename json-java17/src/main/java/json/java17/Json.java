/*
 * Copyright (c) 2025, 2026, Oracle and/or its affiliates. All rights reserved.
 * DO NOT ALTER OR REMOVE COPYRIGHT NOTICES OR THIS FILE HEADER.
 *
 * This code is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License version 2 only, as
 * published by the Free Software Foundation.  Oracle designates this
 * particular file as subject to the "Classpath" exception as provided
 * by Oracle in the LICENSE file that accompanied this code.
 *
 * This code is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE.  See the GNU General Public License
 * version 2 for more details (a copy is included in the LICENSE file that
 * accompanied this code).
 *
 * You should have received a copy of the GNU General Public License version
 * 2 along with this work; if not, write to the Free Software Foundation,
 * Inc., 51 Franklin St, Fifth Floor, Boston, MA 02110-1301 USA.
 *
 * Please contact Oracle, 500 Oracle Parkway, Redwood Shores, CA 94065 USA
 * or visit www.oracle.com if you need additional information or have any
 * questions.
 */

package json.java17;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import json.java17.internal.Utils;

/// This class provides static methods for producing and converting a {@link JsonValue}.
///
/// {@link #fromUntyped(Object)} and {@link #toUntyped(JsonValue)} provide a conversion
/// between `JsonValue` and an untyped object.
///
/// ## Example Usage
/// ```java
/// // Create JSON from Java objects
/// JsonValue fromJava = Json.fromUntyped(Map.of("active", true, "score", 95));
///
/// // Convert to standard Java types
/// Map<String, Object> data = (Map<String, Object>) Json.toUntyped(fromJava);
/// ```
public final class Json {

    /// {@return a `JsonValue` created from the given `src` object}
    /// The mapping from an untyped `src` object to a `JsonValue`
    /// follows the table below.
    ///
    /// | Untyped Object | JsonValue |
    /// |----------------|----------|
    /// | `List<Object>` | `JsonArray` |
    /// | `Boolean` | `JsonBoolean` |
    /// | `null` | `JsonNull` |
    /// | `Number*` | `JsonNumber` |
    /// | `Map<String, Object>` | `JsonObject` |
    /// | `String` | `JsonString` |
    ///
    /// *The supported `Number` subclasses are: `Byte`,
    /// `Short`, `Integer`, `Long`, `Float`,
    /// `Double`, `BigInteger`, and `BigDecimal`.
    ///
    /// If `src` is an instance of `JsonValue`, it is returned as is.
    ///
    /// @param src the data to produce the `JsonValue` from. May be null.
    /// @throws IllegalArgumentException if `src` cannot be converted
    ///         to a `JsonValue`.
    /// @see #toUntyped(JsonValue)
    public static JsonValue fromUntyped(Object src) {
        if (src == null) {
            return JsonNull.of();
        }
        if (src instanceof JsonValue jv) {
            return jv;
        }
        // Structural: JSON object
        if (src instanceof Map<?, ?> map) {
            final Map<String, JsonValue> m = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException(
                            "The key '%s' is not a String".formatted(entry.getKey()));
                }
                m.put(key, Json.fromUntyped(entry.getValue()));
            }
            // Bypasses defensive copy in JsonObject.of(m)
            return Utils.objectOf(m);
        }
        // Structural: JSON Array
        if (src instanceof List<?> list) {
            final List<JsonValue> l = new ArrayList<>(list.size());
            for (Object o : list) {
                l.add(Json.fromUntyped(o));
            }
            // Bypasses defensive copy in JsonArray.of(l)
            return Utils.arrayOf(l);
        }
        // JSON primitives
        if (src instanceof String str) {
            return JsonString.of(str);
        }
        if (src instanceof Boolean bool) {
            return JsonBoolean.of(bool);
        }
        if (src instanceof Byte || src instanceof Short || src instanceof Integer || src instanceof Long) {
            return JsonNumber.of(((Number) src).longValue());
        }
        if (src instanceof Float || src instanceof Double) {
            return JsonNumber.of(((Number) src).doubleValue());
        }
        if (src instanceof BigInteger bi) {
            return JsonNumber.of(bi);
        }
        if (src instanceof BigDecimal bd) {
            return JsonNumber.of(bd);
        }
        throw new IllegalArgumentException(src.getClass().getSimpleName() + " is not a recognized type");
    }

    /// {@return an `Object` created from the given `src` `JsonValue`}
    /// The mapping from a `JsonValue` to an untyped `src` object follows the table below.
    ///
    /// | JsonValue | Untyped Object |
    /// |-----------|----------------|
    /// | `JsonArray` | `List<Object>` (unmodifiable) |
    /// | `JsonBoolean` | `Boolean` |
    /// | `JsonNull` | `null` |
    /// | `JsonNumber` | `Number` |
    /// | `JsonObject` | `Map<String, Object>` (unmodifiable) |
    /// | `JsonString` | `String` |
    ///
    /// A `JsonObject` in `src` is converted to a `Map` whose
    /// entries occur in the same order as the `JsonObject`'s members.
    ///
    /// @param src the `JsonValue` to convert to untyped. Non-null.
    /// @throws NullPointerException if `src` is `null`
    /// @see #fromUntyped(Object)
    public static Object toUntyped(JsonValue src) {
        Objects.requireNonNull(src);
        if (src instanceof JsonObject jo) {
            // Avoid Collectors.toMap, to allow `null` value
            final Map<String, Object> m = new LinkedHashMap<>();
            jo.members().forEach((k, v) -> m.put(k, Json.toUntyped(v)));
            return Collections.unmodifiableMap(m);
        }
        if (src instanceof JsonArray ja) {
            final List<Object> l = new ArrayList<>(ja.elements().size());
            for (JsonValue v : ja.elements()) {
                l.add(Json.toUntyped(v));
            }
            return Collections.unmodifiableList(l);
        }
        if (src instanceof JsonBoolean jb) {
            return jb.bool();
        }
        if (src instanceof JsonNumber n) {
            return n.toNumber();
        }
        if (src instanceof JsonString js) {
            return js.string();
        }
        return null;
    }

    // no instantiation is allowed for this class
    private Json() {}
}
