package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;
import org.pragmatica.coffee.error.CompilationException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Object literal. Every property is an {@link Assign} in the property context.
 */
public record ObjectLiteral(List<Assign> properties) implements Node {

    public ObjectLiteral {
        properties = List.copyOf(properties);
        for (var property : properties) {
            if (property.context() != Assign.Context.PROPERTY) {
                throw CompilationException.malformed("object", "property assignment expected");
            }
        }
    }

    public static ObjectLiteral of(Assign... properties) {
        return new ObjectLiteral(List.of(properties));
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
        if (properties.isEmpty()) {
            return "{}";
        }
        var inner = indent + TAB;
        var props = properties.stream()
                              .map(property -> inner + property.compile(inner, scope, options.plain()))
                              .collect(Collectors.joining(",\n"));
        return "{\n" + props + "\n" + indent + "}";
    }
}
