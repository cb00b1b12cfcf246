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
package com.mastfrog.code.builder.util;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Function;

/**
 * Argument checks and list joining used by the emitters.
 *
 * @author Tim Boudreau
 */
public final class Utils {

    private Utils() {
        throw new AssertionError();
    }

    public static <T> T notNull(String what, T obj) {
        if (obj == null) {
            throw new IllegalArgumentException(what + " may not be null");
        }
        return obj;
    }

    public static <T extends CharSequence> T notEmpty(String what, T text) {
        if (notNull(what, text).length() == 0) {
            throw new IllegalArgumentException(what + " may not be empty");
        }
        return text;
    }

    public static String join(String delimiter, Iterable<?> items) {
        return join(delimiter, items, Objects::toString);
    }

    /**
     * Join the text form of some items, walking them exactly once.
     *
     * @param <T> The item type
     * @param delimiter Placed between adjacent items
     * @param items The items
     * @param toText Converts an item to text
     * @return A string
     */
    public static <T> String join(String delimiter, Iterable<? extends T> items,
            Function<? super T, ? extends CharSequence> toText) {
        StringBuilder result = new StringBuilder();
        for (Iterator<? extends T> it = items.iterator(); it.hasNext();) {
            result.append(toText.apply(it.next()));
            if (it.hasNext()) {
                result.append(delimiter);
            }
        }
        return result.toString();
    }
}
