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

import json.java17.internal.JsonNumberImpl;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/// The interface that represents a JSON number, an arbitrary-precision
/// number represented in base 10 using decimal digits.
///
/// {@link #of(double)}, {@link #of(long)}, {@link #of(String)},
/// {@link #of(BigInteger)} or {@link #of(BigDecimal)} can be used to obtain
/// a `JsonNumber`. The value of the `JsonNumber` can be retrieved as a `long`
/// with {@link #toLong()} or as a `double` with {@link #toDouble()}.
/// `toString()` returns the lexical form the number was created from.
///
/// A number created by {@link #of(double)} from `NaN` or an infinity keeps the
/// lexical form `NaN`, `Infinity` or `-Infinity`. Such numbers are not valid
/// JSON text; {@link #isFinite()} reports them.
///
/// @apiNote
/// To avoid precision loss when converting JSON numbers to Java types, or when
/// converting JSON numbers outside the range of `long` or `double`, use
/// `toString()` to create arbitrary-precision Java objects.
public non-sealed interface JsonNumber extends JsonValue {

    /// {@return a `long` if it can be translated from the string
    /// representation of this `JsonNumber`} The value must be a whole number
    /// and within the range of {@link Long#MIN_VALUE} and {@link Long#MAX_VALUE}.
    ///
    /// @throws JsonAssertionException if this `JsonNumber` cannot
    ///         be represented as a `long`.
    @Override
    long toLong();

    /// {@return the nearest `double` to this `JsonNumber`} Non-finite lexical
    /// forms return the corresponding non-finite `double`.
    @Override
    double toDouble();

    /// {@return a `Number` for this value} Whole numbers within the range of
    /// `long` return a `Long`, larger whole numbers a `BigInteger`, anything
    /// else a `Double`.
    Number toNumber();

    /// {@return true if the lexical form is a whole number written without a
    /// fraction or an exponent}
    boolean isIntegral();

    /// {@return false if this number was created from `NaN` or an infinity}
    boolean isFinite();

    /// Creates a JSON number from the given `double` value.
    /// The string representation of the JSON number created is produced by
    /// applying {@link Double#toString(double)} on `num`.
    ///
    /// @param num the given `double` value.
    /// @return a JSON number created from the `double` value
    static JsonNumber of(double num) {
        return new JsonNumberImpl(Double.toString(num));
    }

    /// Creates a JSON number from the given `long` value.
    /// The string representation of the JSON number created is produced by
    /// applying {@link Long#toString(long)} on `num`.
    ///
    /// @param num the given `long` value.
    /// @return a JSON number created from the `long` value
    static JsonNumber of(long num) {
        return new JsonNumberImpl(Long.toString(num));
    }

    /// Creates a JSON number from the given `BigInteger` value.
    ///
    /// @param num the given `BigInteger` value. Non-null.
    /// @return a JSON number created from the `BigInteger` value
    static JsonNumber of(BigInteger num) {
        Objects.requireNonNull(num);
        return new JsonNumberImpl(num.toString());
    }

    /// Creates a JSON number from the given `BigDecimal` value.
    ///
    /// @param num the given `BigDecimal` value. Non-null.
    /// @return a JSON number created from the `BigDecimal` value
    static JsonNumber of(BigDecimal num) {
        Objects.requireNonNull(num);
        return new JsonNumberImpl(num.toString());
    }

    /// Creates a JSON number from the given `String` value.
    /// The string representation of the JSON number created is equivalent to `num`.
    ///
    /// @param num the given `String` value in decimal notation, as accepted
    ///        by {@link BigDecimal#BigDecimal(String)}. Non-null.
    /// @return a JSON number created from the `String` value
    /// @throws IllegalArgumentException if `num` is not a valid string
    ///         representation of a number.
    static JsonNumber of(String num) {
        Objects.requireNonNull(num);
        try {
            new BigDecimal(num);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Not a JSON number: " + num, ex);
        }
        return new JsonNumberImpl(num);
    }

    /// {@return the string representation of this `JsonNumber`}
    @Override
    String toString();

    /// {@return true if the given `obj` is equal to this `JsonNumber`}
    /// The comparison is based on the string representation of this `JsonNumber`,
    /// ignoring the case.
    ///
    /// @see #toString()
    @Override
    boolean equals(Object obj);

    /// {@return the hash code value of this `JsonNumber`} The returned hash code
    /// is derived from the string representation of this `JsonNumber`,
    /// ignoring the case.
    ///
    /// @see #toString()
    @Override
    int hashCode();
}
