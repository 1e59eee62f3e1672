package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;

/**
 * Assignment to a local variable, to an accessed property, or a property of an object literal.
 */
public record Assign(Node target, Node value, Context context) implements Node {

    /**
     * Where the assignment appears.
     */
    public enum Context {
        /**
         * Ordinary assignment statement or expression.
         */
        VARIABLE,
        /**
         * Property of an object literal: emitted as {@code name: value}, never declares anything.
         */
        PROPERTY
    }

    public static Assign of(Node target, Node value) {
        return new Assign(target, value, Context.VARIABLE);
    }

    public static Assign of(String name, Node value) {
        return of(Literal.of(name), value);
    }

    public static Assign property(Node target, Node value) {
        return new Assign(target, value, Context.PROPERTY);
    }

    public static Assign property(String name, Node value) {
        return property(Literal.of(name), value);
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

    @Override
    public String compile(String indent, Scope scope, CompileOptions options) {
        var parts = targetParts(indent, scope, options);
        var name = parts.text();
        var last = parts.last();

        if (context == Context.PROPERTY) {
            return name + ": " + value.compile(indent, scope, options.plain().withLastAssigned(last));
        }
        if (target instanceof Value variable && variable.hasSuffixes()) {
            return value.hasCustomAssign()
                   ? value.compile(indent, scope, options.plain().withAssign(name, last))
                   : name + " = " + value.compile(indent, scope, options.plain().withLastAssigned(last));
        }
        return compileLocal(name, last, indent, scope, options);
    }

    private Value.Parts targetParts(String indent, Scope scope, CompileOptions options) {
        if (target instanceof Value variable) {
            return variable.compileParts(indent, scope, options.plain());
        }
        var text = target.compile(indent, scope, options.plain());
        return new Value.Parts(text, text);
    }

    private String compileLocal(String name, String last, String indent, Scope scope, CompileOptions options) {
        var declared = scope.declareIfAbsent(name);
        if (value.hasCustomAssign()) {
            var declaration = declared
                              ? ""
                              : "var " + name + ";\n" + indent;
            return declaration + value.compile(indent, scope, options.forBody().withAssign(name, last));
        }
        var head = declared
                   ? name
                   : "var " + name;
        var assignment = head + " = " + value.compile(indent, scope, options.plain().withLastAssigned(last));
        // the freshly declared variable holds the value to return
        return !declared && options.returns()
               ? assignment + ";\n" + indent + "return " + name
               : assignment;
    }
}
