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
import java.util.function.Supplier;

/**
 * A unit of deferred code generation: writes into the CodeBuilder it is
 * passed, synchronously, when invoked. Used for block bodies, call arguments
 * and initializer expressions.
 *
 * @author Tim Boudreau
 */
@FunctionalInterface
public interface CodeGenerator {

    /**
     * Drive the passed CodeBuilder to append whatever this generator
     * produces.
     *
     * @param builder A CodeBuilder
     */
    void generateInto(CodeBuilder builder);

    public static CodeGenerator lazy(Supplier<? extends CodeGenerator> s) {
        return cb -> {
            s.get().generateInto(cb);
        };
    }

    /**
     * Adapt a plain consumer into a generator.
     *
     * @param consumer A consumer
     * @return A generator
     */
    public static CodeGenerator of(Consumer<? super CodeBuilder> consumer) {
        return consumer::accept;
    }

    /**
     * Render this generator into a new CodeBuilder with default settings.
     *
     * @return A string
     */
    default String stringify() {
        CodeBuilder cb = new CodeBuilder();
        generateInto(cb);
        return cb.data();
    }
}
