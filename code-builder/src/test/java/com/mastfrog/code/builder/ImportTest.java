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

import java.util.Arrays;
import java.util.Collections;
import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

/**
 *
 * @author Tim Boudreau
 */
public class ImportTest {

    @Test
    public void testWholeModule() {
        CodeBuilder cb = new CodeBuilder();
        cb.addImport("std.stdio");
        assertEquals("import std.stdio;\n", cb.data());
    }

    @Test
    public void testSelectiveImport() {
        CodeBuilder cb = new CodeBuilder();
        cb.addImport("std.stdio", Arrays.asList("readln", "writeln"));
        assertEquals("import std.stdio : readln, writeln;\n", cb.data());
    }

    @Test
    public void testEmptySelectionIsNotTheSameAsNone() {
        CodeBuilder cb = new CodeBuilder();
        cb.addImport("std.stdio", Collections.emptyList());
        assertEquals("import std.stdio : ;\n", cb.data());
        cb = new CodeBuilder();
        cb.addImport("std.stdio", null);
        assertEquals("import std.stdio;\n", cb.data());
    }

    @Test
    public void testImportsAreIndented() {
        CodeBuilder cb = new CodeBuilder();
        cb.withScope(b -> {
            b.addImport("std.conv", Arrays.asList("to"));
            b.addImport("std.math");
        });
        assertEquals("{\n\timport std.conv : to;\n\timport std.math;\n}\n", cb.data());
    }
}
