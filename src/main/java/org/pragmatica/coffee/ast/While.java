package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;

/**
 * Pretested loop - the only low-level loop of the source language.
 */
public record While(Node condition, Expressions body) implements Node {

    public static While of(Node condition, Node... body) {
        return new While(condition, Expressions.of(body));
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
    public String lineTerminator() {
        return "";
    }

    @Override
    public String compile(String indent, Scope scope, CompileOptions options) {
        return "while (" + condition.compile(indent, scope, options.plain().withNoParen()) + ") {\n"
               + body.compile(indent + TAB, scope, options.plain()) + "\n" + indent + "}";
    }
}
