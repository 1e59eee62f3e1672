package org.pragmatica.coffee.compiler;

import java.util.Optional;

/**
 * Immutable options threaded through {@code Node.compile}.
 * Every recursive call receives a record derived with one of the {@code with*} methods,
 * so sibling subtrees never observe each other's options.
 *
 * @param returns      the compiled node must deliver its value with {@code return}
 * @param assign       the compiled node must store its value into this target
 * @param lastAssigned final accessor text of the innermost enclosing assignment, used to resolve super calls
 * @param statement    force an if-statement form instead of a ternary
 * @param noParen      the caller already groups the expression, so no extra parentheses are needed
 */
public record CompileOptions(
    boolean returns,
    Optional<String> assign,
    Optional<String> lastAssigned,
    boolean statement,
    boolean noParen
) {
    public static final CompileOptions NONE = new CompileOptions(
        false,
        Optional.empty(),
        Optional.empty(),
        false,
        false
    );

    /**
     * Options for a child compiled for its value only: intent flags are cleared, method context is kept.
     */
    public CompileOptions plain() {
        return new CompileOptions(false, Optional.empty(), lastAssigned, false, false);
    }

    /**
     * Options for the body of a compound node: return and assignment intent flow in,
     * a forced statement form and parenthesis suppression do not.
     */
    public CompileOptions forBody() {
        return new CompileOptions(returns, assign, lastAssigned, false, false);
    }

    public CompileOptions withReturn() {
        return new CompileOptions(true, assign, lastAssigned, statement, noParen);
    }

    public CompileOptions withoutReturn() {
        return new CompileOptions(false, assign, lastAssigned, statement, noParen);
    }

    public CompileOptions withAssign(String target, String lastName) {
        return new CompileOptions(returns, Optional.of(target), Optional.of(lastName), statement, noParen);
    }

    public CompileOptions withLastAssigned(String lastName) {
        return new CompileOptions(returns, assign, Optional.of(lastName), statement, noParen);
    }

    public CompileOptions withStatement() {
        return new CompileOptions(returns, assign, lastAssigned, true, noParen);
    }

    public CompileOptions withNoParen() {
        return new CompileOptions(returns, assign, lastAssigned, statement, true);
    }
}
