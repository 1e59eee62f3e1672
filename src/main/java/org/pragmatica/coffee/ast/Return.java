package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;

/**
 * Explicit return. Asks the expression to return itself when it knows how to.
 */
public record Return(Node expression) implements Node {

    public static Return of(Node expression) {
        return new Return(expression);
    }

    @Override
    public boolean isStatement() {
        return true;
    }

    @Override
    public boolean hasCustomReturn() {
        return true;
    }

    @Override
    public boolean hasCustomAssign() {
        return false;
    }

    // a delegated expression terminates its own return line
    @Override
    public String lineTerminator() {
        return expression.hasCustomReturn()
               ? expression.lineTerminator()
               : ";";
    }

    @Override
    public String compile(String indent, Scope scope, CompileOptions options) {
        if (expression.hasCustomReturn()) {
            return expression.compile(indent, scope, options.withReturn());
        }
        var compiled = expression.compile(indent, scope, options.plain());
        // a statement has no value, the function still has to return something
        return expression.isStatement()
               ? compiled + "\n" + indent + "return null"
               : "return " + compiled;
    }
}
