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

/// Provides the immutable JSON value model: {@link json.java17.JsonValue} and
/// its variants {@link json.java17.JsonObject}, {@link json.java17.JsonArray},
/// {@link json.java17.JsonString}, {@link json.java17.JsonNumber},
/// {@link json.java17.JsonBoolean} and {@link json.java17.JsonNull}.
///
/// ## Building values
/// Values are created with the `of` factories or converted from plain Java
/// collections with {@link json.java17.Json#fromUntyped(Object)}. `JsonObject`s
/// preserve the order of their members.
///
/// ## Retrieving values
/// Retrieving values involves two steps: first navigating the structure using
/// access methods, and then converting the result to the desired type using
/// conversion methods. For example:
/// ```java
/// var name = doc.get("foo").get("bar").element(0).string();
/// ```
///
/// ## Generating JSON text
/// `JsonValue.toString()` produces the compact JSON representation.
package json.java17;
