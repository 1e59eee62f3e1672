package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;

/**
 * Syntax tree node - every element of a program that compiles to target source.
 *
 * <p>The three capability flags are declared by every variant:
 * <ul>
 *   <li>statement - the compiled form cannot be used as a value;</li>
 *   <li>custom return - when a return is requested the node must be compiled with
 *       {@link CompileOptions#returns()} set instead of being prefixed with {@code return};</li>
 *   <li>custom assign - when an assignment is requested the node receives the target through
 *       {@link CompileOptions#assign()} and emits the assignment itself.</li>
 * </ul>
 */
public sealed interface Node
    permits Expressions, Literal, Return, Call, Value, Assign, Op, Code, ObjectLiteral, ArrayLiteral,
            While, For, Try, Throw, Parenthetical, If {

    /**
     * Indentation unit of generated source.
     */
    String TAB = "  ";

    boolean isStatement();

    boolean hasCustomReturn();

    boolean hasCustomAssign();

    /**
     * Text appended after the node when it occupies a line of a block.
     */
    default String lineTerminator() {
        return ";";
    }

    /**
     * Canonical single-node representation of this node.
     */
    default Node unwrap() {
        return this;
    }

    /**
     * Compile the node into target source.
     *
     * @param indent  indentation of the line the node starts on
     * @param scope   scope of the enclosing function literal
     * @param options intent of the caller
     */
    String compile(String indent, Scope scope, CompileOptions options);
}
