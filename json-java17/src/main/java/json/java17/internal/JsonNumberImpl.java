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

import json.java17.JsonNumber;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/// JsonNumber implementation class
public final class JsonNumberImpl implements JsonNumber {

    private final String text;

    public JsonNumberImpl(String text) {
        this.text = text;
    }

    @Override
    public long toLong() {
        if (!isFinite()) {
            throw Utils.composeError(this, "%s cannot be represented as a long.".formatted(text));
        }
        try {
            return new BigDecimal(text).longValueExact();
        } catch (ArithmeticException ex) {
            throw Utils.composeError(this, "%s cannot be represented as a long.".formatted(text));
        }
    }

    @Override
    public double toDouble() {
        // Double.parseDouble reads NaN, Infinity and -Infinity as well
        return Double.parseDouble(text);
    }

    @Override
    public Number toNumber() {
        if (isIntegral()) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException ex) {
                return new BigInteger(text);
            }
        }
        return toDouble();
    }

    @Override
    public boolean isIntegral() {
        int i = text.startsWith("-") ? 1 : 0;
        if (i == text.length()) {
            return false;
        }
        for (; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean isFinite() {
        return !text.endsWith("Infinity") && !text.equals("NaN");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonNumber other && text.equalsIgnoreCase(other.toString());
    }

    @Override
    public int hashCode() {
        return text.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
