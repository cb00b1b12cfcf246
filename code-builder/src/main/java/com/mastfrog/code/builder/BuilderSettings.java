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

/**
 * The tokens and whitespace a CodeBuilder emits: what one level of
 * indentation looks like, how lines end, how blocks open and close and so
 * forth. Everything the builder writes that is not caller-supplied text comes
 * from here.
 *
 * @author Tim Boudreau
 */
public interface BuilderSettings {

    /**
     * The text written once per indent level at the start of an indented
     * line.
     *
     * @return A non-empty string, a single tab by default
     */
    String indentUnit();

    /**
     * The text appended after a put() when automatic newlines are in effect.
     *
     * @return A non-empty string
     */
    String lineTerminator();

    char stringQuote();

    char blockOpen();

    char blockClose();

    char statementTerminator();

    String importKeyword();

    String importSelectionSeparator();

    String argumentDelimiter();

    String assignment();

    String returnKeyword();

    String aliasKeyword();

    String enumKeyword();

    /**
     * Get the default settings: tab indentation, unix line endings and
     * C-family punctuation.
     *
     * @return The default settings
     */
    static BuilderSettings defaults() {
        return DefaultBuilderSettings.DEFAULT;
    }
}
