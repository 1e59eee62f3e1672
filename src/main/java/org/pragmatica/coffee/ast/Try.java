package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;
import org.pragmatica.coffee.error.CompilationException;

import java.util.Optional;

/**
 * try/catch/finally block. Return intent flows into every block.
 *
 * @param attempt  guarded block
 * @param error    name bound to the caught error
 * @param recovery catch block
 * @param ensure   finally block
 */
public record Try(Expressions attempt, Optional<String> error, Optional<Expressions> recovery,
                  Optional<Expressions> ensure) implements Node {

    public Try {
        if (recovery.isPresent() && error.filter(name -> !name.isBlank()).isEmpty()) {
            throw CompilationException.malformed("try", "catch block requires an error name");
        }
    }

    public static Try of(Expressions attempt, String error, Expressions recovery) {
        return new Try(attempt, Optional.of(error), Optional.of(recovery), Optional.empty());
    }

    public static Try of(Expressions attempt, String error, Expressions recovery, Expressions ensure) {
        return new Try(attempt, Optional.of(error), Optional.of(recovery), Optional.of(ensure));
    }

    public static Try withFinally(Expressions attempt, Expressions ensure) {
        return new Try(attempt, Optional.empty(), Optional.empty(), Optional.of(ensure));
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
        var blockOptions = options.forBody();
        var inner = indent + TAB;
        var catchPart = recovery.map(block -> " catch (" + error.get() + ") {\n"
                                              + block.compile(inner, scope, blockOptions) + "\n" + indent + "}")
                                .orElse("");
        var finallyPart = ensure.map(block -> " finally {\n"
                                              + block.compile(inner, scope, blockOptions) + "\n" + indent + "}")
                                .orElse("");
        return "try {\n" + attempt.compile(inner, scope, blockOptions) + "\n" + indent + "}" + catchPart + finallyPart;
    }
}
