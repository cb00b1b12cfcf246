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

import java.util.concurrent.atomic.AtomicInteger;
import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

/**
 *
 * @author Tim Boudreau
 */
public class CodeGeneratorTest {

    @Test
    public void testStringify() {
        CodeGenerator gen = cb -> cb.addImport("std.stdio");
        assertEquals("import std.stdio;\n", gen.stringify());
    }

    @Test
    public void testLazyDefersCreation() {
        AtomicInteger created = new AtomicInteger();
        CodeGenerator lazy = CodeGenerator.lazy(() -> {
            created.incrementAndGet();
            return cb -> cb.put("x");
        });
        assertEquals(0, created.get());
        assertEquals("x\n", lazy.stringify());
        assertEquals(1, created.get());
    }

    @Test
    public void testOf() {
        CodeGenerator gen = CodeGenerator.of(cb -> cb.addReturn("0"));
        assertEquals("return 0;\n", gen.stringify());
    }
}
