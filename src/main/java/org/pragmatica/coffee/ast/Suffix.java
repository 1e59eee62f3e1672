package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;
import org.pragmatica.coffee.error.CompilationException;

/**
 * Accessor attached to a {@link Value}. Suffixes never stand alone: they only compile
 * as part of the value that owns them.
 */
public sealed interface Suffix {

    String compile(String indent, Scope scope, CompileOptions options);

    /**
     * Dotted property access: .name
     */
    record Accessor(String name) implements Suffix {
        public Accessor {
            if (name == null || name.isBlank()) {
                throw CompilationException.malformed("accessor", "property name must not be blank");
            }
        }

        @Override
        public String compile(String indent, Scope scope, CompileOptions options) {
            return "." + name;
        }
    }

    /**
     * Indexed access: [index]
     */
    record Index(Node index) implements Suffix {
        @Override
        public String compile(String indent, Scope scope, CompileOptions options) {
            return "[" + index.compile(indent, scope, options.plain()) + "]";
        }
    }

    /**
     * Array slice with an inclusive upper bound, unlike the target's half-open slice.
     */
    record Slice(Node from, Node to) implements Suffix {
        @Override
        public String compile(String indent, Scope scope, CompileOptions options) {
            return ".slice(" + from.compile(indent, scope, options.plain()) + ", "
                   + to.compile(indent, scope, options.plain()) + " + 1)";
        }
    }

    static Accessor accessor(String name) {
        return new Accessor(name);
    }

    static Index index(Node index) {
        return new Index(index);
    }

    static Slice slice(Node from, Node to) {
        return new Slice(from, to);
    }
}
