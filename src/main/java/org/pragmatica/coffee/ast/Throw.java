package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;

/**
 * Throw an exception.
 */
public record Throw(Node expression) implements Node {

    public static Throw of(Node expression) {
        return new Throw(expression);
    }

    @Override
    public boolean isStatement() {
        return true;
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
        return "throw " + expression.compile(indent, scope, options.plain());
    }
}
