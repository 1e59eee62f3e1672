package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;
import org.pragmatica.coffee.error.CompilationException;

import java.util.Optional;

/**
 * Conditional. Compiles into a ternary when both branches are expressions and into an
 * if/else statement otherwise, pushing a requested return down into the branches.
 * Switch/case is lowered into a chain of these linked through their else branch.
 */
public final class If implements Node {

    private final Node condition;
    private final Node body;
    private final Optional<Node> elseBody;
    private final boolean chain;
    private final boolean statement;

    private If(Node condition, Node body, Optional<Node> elseBody) {
        this.condition = condition;
        this.body = body.unwrap();
        this.elseBody = elseBody.map(Node::unwrap);
        this.chain = this.elseBody.filter(If.class::isInstance)
                                  .isPresent();
        this.statement = this.body.isStatement()
                         || this.elseBody.map(Node::isStatement)
                                         .orElse(false);
    }

    public static If of(Node condition, Node body) {
        return new If(condition, body, Optional.empty());
    }

    public static If of(Node condition, Node body, Node elseBody) {
        return new If(condition, body, Optional.of(elseBody));
    }

    /**
     * Conditional with the condition inverted.
     */
    public static If unless(Node condition, Node body) {
        return of(Op.unary("!", condition), body);
    }

    public static If unless(Node condition, Node body, Node elseBody) {
        return of(Op.unary("!", condition), body, elseBody);
    }

    public Node condition() {
        return condition;
    }

    public Node body() {
        return body;
    }

    public Optional<Node> elseBody() {
        return elseBody;
    }

    /**
     * Whether the else branch is itself a conditional.
     */
    public boolean isChain() {
        return chain;
    }

    /**
     * Attach an else branch to the deepest link of the chain.
     */
    public If withElse(Node branch) {
        if (elseBody.isEmpty()) {
            return new If(condition, body, Optional.of(branch));
        }
        if (!chain) {
            throw CompilationException.malformed("if", "else branch is already attached");
        }
        return new If(condition, body, Optional.of(nested().withElse(branch)));
    }

    /**
     * Turn every condition of the chain into an equality test against the switch subject.
     */
    public If rewriteConditionForSwitch(Node subject) {
        var rewritten = Op.binary("is", subject, condition);
        return chain
               ? new If(rewritten, body, Optional.of(nested().rewriteConditionForSwitch(subject)))
               : new If(rewritten, body, elseBody);
    }

    /**
     * Use the block as the final else branch of the chain.
     */
    public If appendDefaultElse(Expressions defaults) {
        return chain
               ? new If(condition, body, Optional.of(nested().appendDefaultElse(defaults)))
               : new If(condition, body, Optional.of(defaults));
    }

    private If nested() {
        return (If) elseBody.get();
    }

    @Override
    public boolean isStatement() {
        return statement;
    }

    @Override
    public boolean hasCustomReturn() {
        return statement;
    }

    @Override
    public boolean hasCustomAssign() {
        return false;
    }

    @Override
    public String lineTerminator() {
        return statement
               ? ""
               : ";";
    }

    @Override
    public String compile(String indent, Scope scope, CompileOptions options) {
        return options.statement() || statement
               ? compileStatement(indent, scope, options)
               : compileTernary(indent, scope, options);
    }

    // chained else branches are forced into statement form
    private String compileStatement(String indent, Scope scope, CompileOptions options) {
        var bodyOptions = options.forBody();
        var inner = indent + TAB;
        var ifPart = "if (" + condition.compile(indent, scope, options.plain().withNoParen()) + ") {\n"
                     + Expressions.wrap(body).compile(inner, scope, bodyOptions) + "\n" + indent + "}";
        if (elseBody.isEmpty()) {
            return ifPart;
        }
        var elsePart = chain
                       ? " else " + nested().compile(indent, scope, bodyOptions.withStatement())
                       : " else {\n" + Expressions.wrap(elseBody.get()).compile(inner, scope, bodyOptions) + "\n" + indent + "}";
        return ifPart + elsePart;
    }

    private String compileTernary(String indent, Scope scope, CompileOptions options) {
        var branch = options.plain();
        var elsePart = elseBody.map(node -> node.compile(indent, scope, branch))
                               .orElse("null");
        return condition.compile(indent, scope, branch) + " ? " + body.compile(indent, scope, branch) + " : " + elsePart;
    }

    @Override
    public String toString() {
        return "If[condition=" + condition + ", body=" + body + ", elseBody=" + elseBody + "]";
    }
}
