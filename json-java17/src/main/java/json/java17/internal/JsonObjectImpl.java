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

import json.java17.JsonObject;
import json.java17.JsonValue;

import java.util.Collections;
import java.util.Map;

/// JsonObject implementation class
public final class JsonObjectImpl implements JsonObject {

    private final Map<String, JsonValue> members;

    /// The map must iterate in member order; `JsonObject.of` passes a `LinkedHashMap`.
    public JsonObjectImpl(Map<String, JsonValue> members) {
        this.members = Collections.unmodifiableMap(members);
    }

    @Override
    public Map<String, JsonValue> members() {
        return members;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonObject other && members.equals(other.members());
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        final var sb = new StringBuilder("{");
        boolean first = true;
        for (var entry : members.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            Utils.appendQuoted(sb, entry.getKey()).append(':').append(entry.getValue());
        }
        return sb.append('}').toString();
    }
}
