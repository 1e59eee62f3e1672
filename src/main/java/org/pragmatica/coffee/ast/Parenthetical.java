package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;

/**
 * Explicit grouping written in the source.
 */
public record Parenthetical(Expressions expressions) implements Node {

    public static Parenthetical of(Node... nodes) {
        return new Parenthetical(Expressions.of(nodes));
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
        var inner = expressions.unwrap();
        // a single node never emits its own terminator, a block omits the last one
        var compiled = inner instanceof Expressions block
                       ? block.compileBlock(indent, scope, options.plain(), false)
                       : inner.compile(indent, scope, options.plain());
        return options.noParen()
               ? compiled
               : "(" + compiled + ")";
    }
}
