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

package json.java17.internal;

import json.java17.JsonArray;
import json.java17.JsonAssertionException;
import json.java17.JsonBoolean;
import json.java17.JsonNull;
import json.java17.JsonNumber;
import json.java17.JsonObject;
import json.java17.JsonString;
import json.java17.JsonValue;

import java.util.List;
import java.util.Map;

/// Shared helpers for the value implementations.
public final class Utils {

    // no instantiation is allowed for this class
    private Utils() {}

    /// {@return a `JsonArray` wrapping the given list without a defensive copy}
    /// Callers must not retain or mutate `list` afterwards.
    public static JsonArray arrayOf(List<JsonValue> list) {
        return new JsonArrayImpl(list);
    }

    /// {@return a `JsonObject` wrapping the given map without a defensive copy}
    /// Callers must not retain or mutate `map` afterwards.
    public static JsonObject objectOf(Map<String, JsonValue> map) {
        return new JsonObjectImpl(map);
    }

    public static JsonAssertionException composeTypeError(JsonValue jv, String expected) {
        return composeError(jv, "%s is not a %s.".formatted(typeName(jv), expected));
    }

    public static JsonAssertionException composeError(JsonValue jv, String message) {
        return new JsonAssertionException(message + " Value: " + abbreviate(jv.toString()));
    }

    static String typeName(JsonValue jv) {
        if (jv instanceof JsonObject) {
            return "JsonObject";
        } else if (jv instanceof JsonArray) {
            return "JsonArray";
        } else if (jv instanceof JsonString) {
            return "JsonString";
        } else if (jv instanceof JsonNumber) {
            return "JsonNumber";
        } else if (jv instanceof JsonBoolean) {
            return "JsonBoolean";
        } else if (jv instanceof JsonNull) {
            return "JsonNull";
        }
        throw new InternalError("type mismatch");
    }

    private static String abbreviate(String s) {
        return s.length() > 64 ? s.substring(0, 64) + "..." : s;
    }

    /// Appends the JSON string literal for `value`, including the surrounding quotes.
    static StringBuilder appendQuoted(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"');
    }

}
