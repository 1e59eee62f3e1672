package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;
import org.pragmatica.coffee.error.CompilationException;

import java.util.List;

/**
 * Function literal. The only node that opens a new scope.
 */
public record Code(List<String> parameters, Expressions body) implements Node {

    public Code {
        parameters = List.copyOf(parameters);
        for (var parameter : parameters) {
            if (parameter.isBlank()) {
                throw CompilationException.malformed("function", "parameter name must not be blank");
            }
        }
    }

    public static Code of(List<String> parameters, Node... body) {
        return new Code(parameters, new Expressions(List.of(body)));
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
        var functionScope = scope.childScope();
        parameters.forEach(functionScope::declare);
        // the last expression of a function body is its result
        var code = body.compile(indent + TAB, functionScope, options.plain().withReturn());
        return "function(" + String.join(", ", parameters) + ") {\n" + code + "\n" + indent + "}";
    }
}
