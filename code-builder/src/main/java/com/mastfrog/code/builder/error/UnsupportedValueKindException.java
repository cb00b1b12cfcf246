/*
 * The MIT License
 *
 * Copyright 2026 Mastfrog Technologies.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package com.mastfrog.code.builder.error;

/**
 * Thrown when a value handed to a CodeBuilder as an argument, initializer or
 * return expression is of a kind the builder has no text form for. The
 * builder's buffer keeps whatever was written before the failure.
 *
 * @author Tim Boudreau
 */
public final class UnsupportedValueKindException extends IllegalArgumentException {

    private final String valueKind;

    public UnsupportedValueKindException(Object value) {
        this(kindOf(value));
    }

    private UnsupportedValueKindException(String valueKind) {
        super("Cannot emit a value of type " + valueKind);
        this.valueKind = valueKind;
    }

    /**
     * The runtime type name of the rejected value, or "null".
     *
     * @return A type name
     */
    public String valueKind() {
        return valueKind;
    }

    private static String kindOf(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
