package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;

import java.util.ArrayList;
import java.util.List;

/**
 * A base value followed by dotted, indexed or sliced accessors.
 */
public record Value(Node base, List<Suffix> suffixes) implements Node {

    public Value {
        suffixes = List.copyOf(suffixes);
    }

    public static Value of(String name, Suffix... suffixes) {
        return new Value(Literal.of(name), List.of(suffixes));
    }

    public static Value of(Node base, Suffix... suffixes) {
        return new Value(base, List.of(suffixes));
    }

    /**
     * Value with the suffix added at the end.
     */
    public Value append(Suffix suffix) {
        var extended = new ArrayList<>(suffixes);
        extended.add(suffix);
        return new Value(base, extended);
    }

    public boolean hasSuffixes() {
        return !suffixes.isEmpty();
    }

    @Override
    public boolean isStatement() {
        return false;
    }

    @Override
    public boolean hasCustomReturn() {
        return false;
    }

    @Override
    public boolean hasCustomAssign() {
        return false;
    }

    @Override
    public String compile(String indent, Scope scope, CompileOptions options) {
        return compileParts(indent, scope, options).text();
    }

    /**
     * Compile the value, keeping the text of its last part for assignments and super calls.
     */
    public Parts compileParts(String indent, Scope scope, CompileOptions options) {
        var text = new StringBuilder(base.compile(indent, scope, options.plain()));
        var last = text.toString();
        for (var suffix : suffixes) {
            last = suffix.compile(indent, scope, options);
            text.append(last);
        }
        return new Parts(text.toString(), last);
    }

    /**
     * Compiled value text and the text of its last compiled part.
     */
    public record Parts(String text, String last) {}
}
