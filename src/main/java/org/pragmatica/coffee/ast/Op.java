package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;
import org.pragmatica.coffee.error.CompilationException;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Arithmetic and logical operation. Source operators are converted to their target
 * spelling on construction.
 */
public record Op(String operator, Node first, Optional<Node> second) implements Node {

    private static final Map<String, String> CONVERSIONS = Map.of(
        "==", "===",
        "!=", "!==",
        "and", "&&",
        "or", "||",
        "is", "===",
        "aint", "!==",
        "not", "!");

    private static final Set<String> CONDITIONALS = Set.of("||=", "&&=");

    public Op {
        if (operator == null || operator.isBlank()) {
            throw CompilationException.malformed("operation", "operator must not be blank");
        }
        operator = CONVERSIONS.getOrDefault(operator, operator);
        if (CONDITIONALS.contains(operator) && second.isEmpty()) {
            throw CompilationException.malformed("operation", "'" + operator + "' requires a right operand");
        }
    }

    public static Op binary(String operator, Node first, Node second) {
        return new Op(operator, first, Optional.of(second));
    }

    public static Op unary(String operator, Node operand) {
        return new Op(operator, operand, Optional.empty());
    }

    public boolean isUnary() {
        return second.isEmpty();
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
        var operand = options.plain();
        if (CONDITIONALS.contains(operator)) {
            return compileConditional(indent, scope, operand);
        }
        if (isUnary()) {
            return compileUnary(indent, scope, operand);
        }
        return first.compile(indent, scope, operand) + " " + operator + " "
               + second.get().compile(indent, scope, operand);
    }

    // a ||= b becomes a = a || b
    private String compileConditional(String indent, Scope scope, CompileOptions options) {
        var left = first.compile(indent, scope, options);
        var right = second.get().compile(indent, scope, options);
        return left + " = " + left + " " + operator.substring(0, 2) + " " + right;
    }

    private String compileUnary(String indent, Scope scope, CompileOptions options) {
        var space = "delete".equals(operator)
                    ? " "
                    : "";
        return operator + space + first.compile(indent, scope, options);
    }
}
