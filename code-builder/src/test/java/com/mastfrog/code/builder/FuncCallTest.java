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
import java.util.Arrays;
import java.util.Collections;
import java.util.function.Consumer;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

/**
 *
 * @author Tim Boudreau
 */
public class FuncCallTest {

    @Test
    public void testMixedArguments() {
        CodeBuilder cb = new CodeBuilder();
        String str = "Hello";
        CodeGenerator func = b -> b.putQuoted("World!");
        VariableRef vari = VariableRef.of("int", "someVar");
        cb.addFuncCall("writeln", str, func, vari);
        assertEquals("writeln(\"Hello\", \"World!\", someVar);\n", cb.data());
    }

    @Test
    public void testNoArguments() {
        CodeBuilder cb = new CodeBuilder();
        cb.addFuncCall("run");
        assertEquals("run();\n", cb.data());
    }

    @Test
    public void testPrimitivesAndChunks() {
        CodeBuilder cb = new CodeBuilder();
        cb.addFuncCall("f", 1, 2L, 1.5d, 'c', false, Arrays.asList("ab", "cd"));
        assertEquals("f(1, 2, 1.5, c, false, \"abcd\");\n", cb.data());
    }

    @Test
    public void testWithoutSemicolon() {
        CodeBuilder cb = new CodeBuilder();
        cb.addFuncCall("f", Arrays.asList("x"), false);
        assertEquals("f(\"x\")", cb.data());
    }

    @Test
    public void testTrailingBooleanIsAnArgument() {
        CodeBuilder cb = new CodeBuilder();
        cb.addFuncCall("f", "a", false);
        assertEquals("f(\"a\", false);\n", cb.data());
    }

    @Test
    public void testCallAsArgument() {
        CodeBuilder cb = new CodeBuilder();
        CodeGenerator inner = b -> b.addFuncCall("sum", Arrays.asList(20, 80), false);
        cb.withIndent(b -> b.addFuncCall("writeln", inner));
        assertEquals("\twriteln(sum(20, 80));\n", cb.data());
    }

    @Test
    public void testPlainConsumerArgument() {
        CodeBuilder cb = new CodeBuilder();
        Consumer<CodeBuilder> c = b -> b.put("x + 1");
        cb.addFuncCall("g", c);
        assertEquals("g(x + 1);\n", cb.data());
    }

    @Test
    public void testUnsupportedArgument() {
        CodeBuilder cb = new CodeBuilder();
        Object bad = new Object();
        UnsupportedValueKindException ex = assertThrows(UnsupportedValueKindException.class,
                () -> cb.addFuncCall("f", 1, bad));
        assertEquals(Object.class.getName(), ex.valueKind());
        assertEquals("f(1, ", cb.data());
        assertEquals(0, cb.indentSuspendCount());
        assertEquals(0, cb.newlineSuspendCount());
    }

    @Test
    public void testNullArgument() {
        CodeBuilder cb = new CodeBuilder();
        UnsupportedValueKindException ex = assertThrows(UnsupportedValueKindException.class,
                () -> cb.addFuncCall("f", Collections.singletonList(null), true));
        assertEquals("null", ex.valueKind());
    }
}
