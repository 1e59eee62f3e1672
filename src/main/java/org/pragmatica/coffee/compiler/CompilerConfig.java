package org.pragmatica.coffee.compiler;

import org.pragmatica.coffee.error.CompilationException;

/**
 * Compiler configuration options.
 *
 * @param wrapInClosure   wrap the program in an immediately-invoked function so top-level names do not leak
 * @param temporaryPrefix prefix of every temporary name minted by {@link Scope#freshTemporary()}
 */
public record CompilerConfig(
    boolean wrapInClosure,
    String temporaryPrefix
) {
    public static final CompilerConfig DEFAULT = new CompilerConfig(
        true,
        "_"
    );

    public CompilerConfig {
        if (temporaryPrefix == null || temporaryPrefix.isBlank()) {
            throw CompilationException.malformed("config", "temporary prefix must not be blank");
        }
    }
}
