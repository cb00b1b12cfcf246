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

import static com.mastfrog.code.builder.util.Utils.notEmpty;

/**
 *
 * @author Tim Boudreau
 */
final class DefaultBuilderSettings implements BuilderSettings {

    static final DefaultBuilderSettings DEFAULT = new DefaultBuilderSettings();

    private final String indentUnit;
    private final String lineTerminator;

    DefaultBuilderSettings(String indentUnit, String lineTerminator) {
        this.indentUnit = notEmpty("indentUnit", indentUnit);
        this.lineTerminator = notEmpty("lineTerminator", lineTerminator);
    }

    DefaultBuilderSettings() {
        this("\t", "\n");
    }

    @Override
    public String indentUnit() {
        return indentUnit;
    }

    @Override
    public String lineTerminator() {
        return lineTerminator;
    }

    @Override
    public char stringQuote() {
        return '"';
    }

    @Override
    public char blockOpen() {
        return '{';
    }

    @Override
    public char blockClose() {
        return '}';
    }

    @Override
    public char statementTerminator() {
        return ';';
    }

    @Override
    public String importKeyword() {
        return "import";
    }

    @Override
    public String importSelectionSeparator() {
        return " : ";
    }

    @Override
    public String argumentDelimiter() {
        return ", ";
    }

    @Override
    public String assignment() {
        return " = ";
    }

    @Override
    public String returnKeyword() {
        return "return";
    }

    @Override
    public String aliasKeyword() {
        return "alias";
    }

    @Override
    public String enumKeyword() {
        return "enum";
    }

    @Override
    public String toString() {
        return "DefaultBuilderSettings(" + indentUnit.length() + " indent chars, "
                + lineTerminator.length() + " line terminator chars)";
    }
}
