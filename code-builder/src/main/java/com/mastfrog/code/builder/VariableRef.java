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

import static com.mastfrog.code.builder.util.Utils.notNull;
import java.util.Objects;
import java.util.Optional;

/**
 * A reference to a variable declared through a CodeBuilder. Passing one as a
 * value to a builder writes its name; it has no connection back to the builder
 * that declared it. Also used for function parameters, which have no
 * initializer.
 *
 * @author Tim Boudreau
 */
public final class VariableRef {

    private final String typeName;
    private final String name;
    private final CodeGenerator initializer;

    public VariableRef(String typeName, String name, CodeGenerator initializer) {
        this.typeName = notNull("typeName", typeName);
        this.name = notNull("name", name);
        this.initializer = initializer;
    }

    public VariableRef(String typeName, String name) {
        this(typeName, name, null);
    }

    public static VariableRef of(String typeName, String name) {
        return new VariableRef(typeName, name);
    }

    public String typeName() {
        return typeName;
    }

    public String name() {
        return name;
    }

    public Optional<CodeGenerator> initializer() {
        return Optional.ofNullable(initializer);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        } else if (o == null || o.getClass() != VariableRef.class) {
            return false;
        }
        VariableRef other = (VariableRef) o;
        return typeName.equals(other.typeName) && name.equals(other.name)
                && Objects.equals(initializer, other.initializer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeName, name, initializer);
    }

    @Override
    public String toString() {
        return typeName + " " + name + (initializer == null ? "" : " = <initializer>");
    }
}
