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

import com.mastfrog.code.builder.error.UnsupportedValueKindException;
import com.mastfrog.code.builder.util.Utils;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns the values callers pass as arguments, initializers and return
 * expressions into text. Every emitter that accepts a caller-supplied value
 * goes through here.
 *
 * @author Tim Boudreau
 */
final class ValueDispatcher {

    private static final Logger LOG = Logger.getLogger(ValueDispatcher.class.getName());

    private ValueDispatcher() {
        throw new AssertionError();
    }

    /**
     * Write a value into the builder.
     *
     * @param into The builder
     * @param value The value
     * @param literal If true, text values are emitted as quoted string
     * literals, as they are for function call arguments
     * @throws UnsupportedValueKindException if the value is of no known kind
     */
    @SuppressWarnings("unchecked")
    static void dispatch(CodeBuilder into, Object value, boolean literal) {
        Object val = ValueKind.isSequence(value) ? copy((Iterable<?>) value) : value;
        ValueKind kind = ValueKind.of(val);
        switch (kind) {
            case TEXT:
                CharSequence text = val instanceof char[]
                        ? new String((char[]) val) : (CharSequence) val;
                if (literal) {
                    into.putQuoted(text);
                } else {
                    into.put(text);
                }
                break;
            case TEXT_SEQUENCE:
                Iterable<? extends CharSequence> chunks = (Iterable<? extends CharSequence>) val;
                if (literal) {
                    into.putQuoted(Utils.join("", chunks));
                } else {
                    into.put(chunks);
                }
                break;
            case CALLBACK:
                ((CodeGenerator) val).generateInto(into);
                break;
            case FUNCTION:
                if (LOG.isLoggable(Level.FINEST)) {
                    LOG.log(Level.FINEST, "Treating {0} as a CodeGenerator", val.getClass().getName());
                }
                dispatch(into, CodeGenerator.of((Consumer<? super CodeBuilder>) val), literal);
                break;
            case VARIABLE:
                into.put(((VariableRef) val).name());
                break;
            case PRIMITIVE:
                into.put(primitiveText(val));
                break;
            default:
                throw new UnsupportedValueKindException(value);
        }
    }

    private static List<Object> copy(Iterable<?> items) {
        List<Object> result = new ArrayList<>();
        for (Object o : items) {
            result.add(o);
        }
        return result;
    }

    static String primitiveText(Object value) {
        if (value instanceof Character) {
            return String.valueOf(((Character) value).charValue());
        }
        return String.valueOf(value);
    }
}
