package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Array literal.
 */
public record ArrayLiteral(List<Node> elements) implements Node {

    public ArrayLiteral {
        elements = List.copyOf(elements);
    }

    public static ArrayLiteral of(Node... elements) {
        return new ArrayLiteral(List.of(elements));
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
        return elements.stream()
                       .map(element -> element.compile(indent, scope, options.plain()))
                       .collect(Collectors.joining(", ", "[", "]"));
    }
}
