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

import json.java17.internal.JsonStringImpl;

import java.util.Objects;

/// The interface that represents a JSON string.
///
/// The unescaped value is retrieved with {@link #string()}, while
/// `toString()` returns the quoted and escaped JSON text.
public non-sealed interface JsonString extends JsonValue {

    /// {@return the unescaped `String` value of this `JsonString`}
    @Override
    String string();

    /// {@return the `JsonString` created from the given `String`}
    ///
    /// @param value the given `String`. Non-null.
    /// @throws NullPointerException if `value` is `null`
    static JsonString of(String value) {
        Objects.requireNonNull(value);
        return new JsonStringImpl(value);
    }

    /// {@return true if the given `obj` is a `JsonString` with an equal value}
    @Override
    boolean equals(Object obj);

    /// {@return the hash code value of this `JsonString`, derived from its value}
    @Override
    int hashCode();
}
