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
package com.mastfrog.code.builder;

import java.util.function.Consumer;

/**
 * The shapes of value a CodeBuilder knows how to emit.
 *
 * @author Tim Boudreau
 */
public enum ValueKind {
    /**
     * A CharSequence or char array, written as-is.
     */
    TEXT,
    /**
     * An Iterable whose elements are all CharSequences, written chunk by
     * chunk.
     */
    TEXT_SEQUENCE,
    /**
     * A CodeGenerator, invoked with the builder.
     */
    CALLBACK,
    /**
     * A plain Consumer, converted to a CodeGenerator and invoked.
     */
    FUNCTION,
    /**
     * A VariableRef, written as its name.
     */
    VARIABLE,
    /**
     * A boxed boolean, character or primitive number, written in its
     * canonical text form.
     */
    PRIMITIVE,
    UNSUPPORTED;

    public boolean isSupported() {
        return this != UNSUPPORTED;
    }

    /**
     * Classify a value. An Iterable is walked to check its elements, so
     * callers that go on to write a single-pass Iterable should classify a
     * copy of it.
     *
     * @param value A value
     * @return Its kind
     */
    public static ValueKind of(Object value) {
        ValueKind result = nonSequenceKind(value);
        if (result != null) {
            return result;
        }
        for (Object o : (Iterable<?>) value) {
            if (!(o instanceof CharSequence)) {
                return UNSUPPORTED;
            }
        }
        return TEXT_SEQUENCE;
    }

    /**
     * Whether the kind of a value can only be determined by walking its
     * elements.
     *
     * @param value A value
     * @return true if it is an Iterable of no other supported kind
     */
    static boolean isSequence(Object value) {
        return nonSequenceKind(value) == null;
    }

    private static ValueKind nonSequenceKind(Object value) {
        if (value instanceof CharSequence || value instanceof char[]) {
            return TEXT;
        } else if (value instanceof CodeGenerator) {
            return CALLBACK;
        } else if (value instanceof VariableRef) {
            return VARIABLE;
        } else if (isPrimitive(value)) {
            return PRIMITIVE;
        } else if (value instanceof Consumer<?>) {
            return FUNCTION;
        } else if (value instanceof Iterable<?>) {
            return null;
        }
        return UNSUPPORTED;
    }

    private static boolean isPrimitive(Object value) {
        return value instanceof Boolean
                || value instanceof Character
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof Double
                || value instanceof Float;
    }
}
