package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;
import org.pragmatica.coffee.error.CompilationException;
import org.pragmatica.coffee.error.CompileError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Function invocation. A super call is turned into a call of the same-named method on the prototype.
 */
public record Call(Callee callee, List<Node> arguments, boolean instantiation) implements Node {

    private static final String LEADING_DOT = ".";

    /**
     * What is being called.
     */
    public sealed interface Callee {
        /**
         * Ordinary callee expression.
         */
        record Named(Node node) implements Callee {}

        /**
         * The method of the same name on the parent prototype.
         */
        record Super() implements Callee {}
    }

    public Call {
        arguments = List.copyOf(arguments);
    }

    public static Call of(Node callee, Node... arguments) {
        return new Call(new Callee.Named(callee), List.of(arguments), false);
    }

    public static Call of(Node callee, List<Node> arguments) {
        return new Call(new Callee.Named(callee), arguments, false);
    }

    public static Call superCall(Node... arguments) {
        return new Call(new Callee.Super(), List.of(arguments), false);
    }

    /**
     * Constructor-call variant of this call.
     */
    public Call instantiate() {
        return new Call(callee, arguments, true);
    }

    public boolean isSuper() {
        return callee instanceof Callee.Super;
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
        var args = arguments.stream()
                            .map(argument -> argument.compile(indent, scope, options.plain().withNoParen()))
                            .collect(Collectors.joining(", "));
        if (callee instanceof Callee.Named named) {
            var prefix = instantiation
                         ? "new "
                         : "";
            return prefix + named.node().compile(indent, scope, options.plain()) + "(" + args + ")";
        }
        return compileSuper(args, options);
    }

    private String compileSuper(String args, CompileOptions options) {
        var method = options.lastAssigned()
                            .map(name -> name.startsWith(LEADING_DOT)
                                         ? name.substring(LEADING_DOT.length())
                                         : name)
                            .orElseThrow(() -> new CompilationException(new CompileError.NoEnclosingMethod(args)));
        var separator = args.isEmpty()
                        ? ""
                        : ", ";
        return "this.constructor.prototype." + method + ".call(this" + separator + args + ")";
    }
}
