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
 * A region of suspended automatic indentation and/or newlines, for use with
 * try-with-resources. Closing releases exactly the suspend counts opening it
 * took, so suspensions may be closed in any order; closing more than once
 * does nothing.
 *
 * @author Tim Boudreau
 */
public final class Suspension implements AutoCloseable {

    private final CodeBuilder builder;
    private final boolean heldIndent;
    private final boolean heldNewline;
    private boolean closed;

    Suspension(CodeBuilder builder, boolean suppressIndent, boolean suppressNewline) {
        this.builder = builder;
        int oldIndent = builder.indentSuspendCount();
        int oldNewline = builder.newlineSuspendCount();
        builder.disable(suppressIndent, suppressNewline);
        // a saturated counter was not incremented, so must not be released
        heldIndent = builder.indentSuspendCount() != oldIndent;
        heldNewline = builder.newlineSuspendCount() != oldNewline;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            builder.enable(heldIndent, heldNewline);
        }
    }
}
