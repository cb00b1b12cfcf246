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
import static com.mastfrog.code.builder.util.Utils.join;
import static com.mastfrog.code.builder.util.Utils.notNull;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Essentially, a smart StringBuilder that indents each line it is given to the
 * current depth and ends it with a newline, unless those behaviors have been
 * suspended. Suspension is reference counted, so a token spread across several
 * put() calls (a parenthesized argument list, say) stays on one line no matter
 * how deeply the code writing it nests. Counters saturate rather than fail:
 * detabbing at depth zero or enabling what was never disabled does nothing.
 * <p>
 * Not thread-safe; a builder belongs to the call chain that created it.
 * </p>
 *
 * @author Tim Boudreau
 */
public final class CodeBuilder {

    private static final Logger LOG = Logger.getLogger(CodeBuilder.class.getName());
    private final BuilderSettings settings;
    private final StringBuilder sb = new StringBuilder(512);
    private int indentDepth;
    private int indentSuspendCount;
    private int newlineSuspendCount;

    public CodeBuilder(BuilderSettings settings) {
        this.settings = notNull("settings", settings);
    }

    public CodeBuilder() {
        this(BuilderSettings.defaults());
    }

    public CodeBuilder(String indentUnit, String lineTerminator) {
        this(new DefaultBuilderSettings(indentUnit, lineTerminator));
    }

    public BuilderSettings settings() {
        return settings;
    }

    public int indentDepth() {
        return indentDepth;
    }

    public int indentSuspendCount() {
        return indentSuspendCount;
    }

    public int newlineSuspendCount() {
        return newlineSuspendCount;
    }

    /**
     * Write some text, indenting it and appending a line terminator.
     *
     * @param content The text
     * @return this
     */
    public CodeBuilder put(CharSequence content) {
        return put(content, true, true);
    }

    /**
     * Write some text. Either flag is ignored while the corresponding
     * behavior is suspended.
     *
     * @param content The text
     * @param autoIndent Whether to prefix the current indentation
     * @param autoNewline Whether to append a line terminator
     * @return this
     */
    public CodeBuilder put(CharSequence content, boolean autoIndent, boolean autoNewline) {
        notNull("content", content);
        if (indentSuspendCount > 0) {
            autoIndent = false;
        }
        if (newlineSuspendCount > 0) {
            autoNewline = false;
        }
        if (autoIndent) {
            for (int i = 0; i < indentDepth; i++) {
                sb.append(settings.indentUnit());
            }
        }
        sb.append(content);
        if (autoNewline) {
            sb.append(settings.lineTerminator());
        }
        return this;
    }

    public CodeBuilder put(char content) {
        return put(String.valueOf(content), true, true);
    }

    public CodeBuilder put(char content, boolean autoIndent, boolean autoNewline) {
        return put(String.valueOf(content), autoIndent, autoNewline);
    }

    public CodeBuilder put(Iterable<? extends CharSequence> chunks) {
        return put(chunks, true, true);
    }

    /**
     * Write a sequence of text chunks, each of which is individually indented
     * and terminated as if passed to put() on its own.
     *
     * @param chunks Some text
     * @param autoIndent Whether to indent each chunk
     * @param autoNewline Whether to terminate each chunk
     * @return this
     */
    public CodeBuilder put(Iterable<? extends CharSequence> chunks, boolean autoIndent, boolean autoNewline) {
        for (CharSequence chunk : notNull("chunks", chunks)) {
            put(chunk, autoIndent, autoNewline);
        }
        return this;
    }

    /**
     * Same as put(content).
     *
     * @param content The text
     * @return this
     */
    public CodeBuilder append(CharSequence content) {
        return put(content);
    }

    public CodeBuilder putFormatted(String template, Object... args) {
        return put(String.format(Locale.ROOT, notNull("template", template), args));
    }

    /**
     * Write a value as a quoted string literal, on the current line. The
     * value is not escaped.
     *
     * @param value The literal content
     * @return this
     */
    public CodeBuilder putQuoted(CharSequence value) {
        notNull("value", value);
        return suspended(cb -> {
            cb.put(settings.stringQuote());
            cb.put(value);
            cb.put(settings.stringQuote());
        });
    }

    /**
     * Write a value of any supported kind: text as-is, a CodeGenerator or
     * Consumer by invoking it with this builder, a VariableRef as its name, a
     * boxed primitive in its canonical form.
     *
     * @param value A value
     * @return this
     * @throws UnsupportedValueKindException if the value is of no supported
     * kind
     * @see ValueKind
     */
    public CodeBuilder putExtended(Object value) {
        ValueDispatcher.dispatch(this, value, false);
        return this;
    }

    public CodeBuilder entab() {
        if (indentDepth == Integer.MAX_VALUE) {
            LOG.log(Level.FINE, "Indent depth saturated at {0}", indentDepth);
            return this;
        }
        indentDepth++;
        return this;
    }

    public CodeBuilder detab() {
        if (indentDepth == 0) {
            LOG.fine("detab() at indent depth zero ignored");
            return this;
        }
        indentDepth--;
        return this;
    }

    /**
     * Suspend both automatic indentation and newlines until a matching
     * enable().
     *
     * @return this
     */
    public CodeBuilder disable() {
        return disable(true, true);
    }

    public CodeBuilder disable(boolean suppressIndent, boolean suppressNewline) {
        if (suppressNewline) {
            newlineSuspendCount = increment(newlineSuspendCount, "newline");
        }
        if (suppressIndent) {
            indentSuspendCount = increment(indentSuspendCount, "indent");
        }
        return this;
    }

    public CodeBuilder enable() {
        return enable(true, true);
    }

    public CodeBuilder enable(boolean resumeIndent, boolean resumeNewline) {
        if (resumeNewline) {
            newlineSuspendCount = decrement(newlineSuspendCount, "newline");
        }
        if (resumeIndent) {
            indentSuspendCount = decrement(indentSuspendCount, "indent");
        }
        return this;
    }

    private static int increment(int count, String what) {
        if (count == Integer.MAX_VALUE) {
            LOG.log(Level.FINE, "{0} suspend count saturated", what);
            return count;
        }
        return count + 1;
    }

    private static int decrement(int count, String what) {
        if (count == 0) {
            LOG.log(Level.FINE, "enable() with {0} not suspended ignored", what);
            return count;
        }
        return count - 1;
    }

    /**
     * Suspend automatic indentation and newlines until the returned object is
     * closed.
     *
     * @return A suspension
     */
    public Suspension suspend() {
        return suspend(true, true);
    }

    public Suspension suspend(boolean suppressIndent, boolean suppressNewline) {
        return new Suspension(this, suppressIndent, suppressNewline);
    }

    /**
     * Run some code with automatic indentation and newlines suspended; the
     * suspension is released however the code exits.
     *
     * @param body The code
     * @return this
     */
    public CodeBuilder suspended(CodeGenerator body) {
        return suspended(true, true, body);
    }

    public CodeBuilder suspended(boolean suppressIndent, boolean suppressNewline, CodeGenerator body) {
        notNull("body", body);
        try (Suspension susp = suspend(suppressIndent, suppressNewline)) {
            body.generateInto(this);
        }
        return this;
    }

    /**
     * Run some code one indent level deeper than the current one; the depth is
     * restored however the code exits.
     *
     * @param body The code
     * @return this
     */
    public CodeBuilder withIndent(CodeGenerator body) {
        notNull("body", body);
        int oldDepth = indentDepth;
        entab();
        try {
            body.generateInto(this);
        } finally {
            indentDepth = oldDepth;
        }
        return this;
    }

    /**
     * Write a block: an opening brace on its own line, the body indented one
     * level, and a closing brace on its own line.
     *
     * @param body The body
     * @return this
     */
    public CodeBuilder withScope(CodeGenerator body) {
        put(settings.blockOpen());
        withIndent(body);
        return put(settings.blockClose());
    }

    private CodeBuilder terminateStatement() {
        return put(settings.statementTerminator(), false, true);
    }

    private static String typeName(Class<?> type) {
        String result = notNull("type", type).getCanonicalName();
        return result == null ? type.getName() : result;
    }

    public CodeBuilder addImport(String moduleName) {
        return addImport(moduleName, null);
    }

    /**
     * Write an import statement. A null selection imports the whole module;
     * an empty one still writes the selection separator.
     *
     * @param moduleName The module
     * @param selection The symbols to import, or null
     * @return this
     */
    public CodeBuilder addImport(String moduleName, List<? extends CharSequence> selection) {
        notNull("moduleName", moduleName);
        put(settings.importKeyword() + " " + moduleName, true, false);
        if (selection != null) {
            suspended(cb -> {
                cb.put(settings.importSelectionSeparator());
                cb.put(join(settings.argumentDelimiter(), selection));
            });
        }
        return terminateStatement();
    }

    public VariableRef addVariable(String typeName, String name) {
        return addVariable(typeName, name, null);
    }

    /**
     * Declare a variable, optionally initialized by the output of a generator.
     *
     * @param typeName The type
     * @param name The variable name
     * @param initializer Writes the initial value, or null for none
     * @return A reference to the variable
     */
    public VariableRef addVariable(String typeName, String name, CodeGenerator initializer) {
        notNull("typeName", typeName);
        notNull("name", name);
        put(typeName + " " + name, true, false);
        if (initializer != null) {
            suspended(cb -> {
                cb.put(settings.assignment());
                cb.putExtended(initializer);
            });
        }
        terminateStatement();
        return new VariableRef(typeName, name, initializer);
    }

    public VariableRef addVariable(Class<?> type, String name) {
        return addVariable(typeName(type), name, null);
    }

    public VariableRef addVariable(Class<?> type, String name, CodeGenerator initializer) {
        return addVariable(typeName(type), name, initializer);
    }

    public VariableRef addAlias(String name, CodeGenerator initializer) {
        return addVariable(settings.aliasKeyword(), name, initializer);
    }

    public VariableRef addEnumValue(String name, CodeGenerator initializer) {
        return addVariable(settings.enumKeyword(), name, initializer);
    }

    /**
     * Write a return statement whose expression is any value putExtended()
     * accepts.
     *
     * @param value The returned expression
     * @return this
     * @throws UnsupportedValueKindException if the value is of no supported
     * kind
     */
    public CodeBuilder addReturn(Object value) {
        put(settings.returnKeyword() + " ", true, false);
        suspended(cb -> cb.putExtended(value));
        return terminateStatement();
    }

    /**
     * Write a function declaration and its body.
     *
     * @param returnType The return type
     * @param name The function name
     * @param parameters The parameters, in order; null means none
     * @param body Writes the statements of the body
     * @return this
     */
    public CodeBuilder addFuncDeclaration(String returnType, String name,
            List<VariableRef> parameters, CodeGenerator body) {
        notNull("returnType", returnType);
        notNull("name", name);
        notNull("body", body);
        List<VariableRef> params = parameters == null
                ? Collections.emptyList() : parameters;
        put(returnType + " " + name, true, false);
        suspended(cb -> {
            cb.put("(");
            cb.put(join(settings.argumentDelimiter(), params,
                    p -> p.typeName() + " " + p.name()));
        });
        put(")", false, true);
        return withScope(body);
    }

    public CodeBuilder addFuncDeclaration(Class<?> returnType, String name,
            List<VariableRef> parameters, CodeGenerator body) {
        return addFuncDeclaration(typeName(returnType), name, parameters, body);
    }

    /**
     * Write a function call statement. Text arguments become string
     * literals; everything else is written as putExtended() would.
     * <p>
     * Every argument after the name is emitted, including a trailing boolean:
     * <code>addFuncCall("f", "a", false)</code> writes <code>f("a", false);</code>.
     * Use {@link #addFuncCall(String, List, boolean)} to leave off the
     * semicolon.
     * </p>
     *
     * @param name The function name
     * @param arguments The arguments
     * @return this
     */
    public CodeBuilder addFuncCall(String name, Object... arguments) {
        return addFuncCall(name, Arrays.asList(notNull("arguments", arguments)), true);
    }

    /**
     * Write a function call, as a statement or, without the trailing
     * semicolon and newline, as an expression. This is the only overload that
     * can omit the semicolon.
     *
     * @param name The function name
     * @param arguments The arguments
     * @param emitTrailingSemicolon Whether to terminate the statement
     * @return this
     * @throws UnsupportedValueKindException if an argument is of no supported
     * kind
     */
    public CodeBuilder addFuncCall(String name, List<?> arguments, boolean emitTrailingSemicolon) {
        notNull("name", name);
        notNull("arguments", arguments);
        put(name, true, false);
        suspended(cb -> {
            cb.put("(");
            for (Iterator<?> it = arguments.iterator(); it.hasNext();) {
                ValueDispatcher.dispatch(cb, it.next(), true);
                if (it.hasNext()) {
                    cb.put(settings.argumentDelimiter());
                }
            }
        });
        put(")", false, false);
        return emitTrailingSemicolon ? terminateStatement() : this;
    }

    /**
     * Get the text written so far.
     *
     * @return The text
     */
    public String data() {
        return sb.toString();
    }

    @Override
    public String toString() {
        return data();
    }
}
