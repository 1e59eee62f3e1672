package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;
import org.pragmatica.coffee.error.CompilationException;

import java.util.Set;

/**
 * Static value emitted verbatim: identifiers, numbers, strings, keywords.
 */
public record Literal(String value) implements Node {

    private static final Set<String> STATEMENTS = Set.of("break", "continue");

    public Literal {
        if (value == null || value.isBlank()) {
            throw CompilationException.malformed("literal", "value must not be blank");
        }
    }

    public static Literal of(String value) {
        return new Literal(value);
    }

    @Override
    public boolean isStatement() {
        return STATEMENTS.contains(value);
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
        return value;
    }
}
