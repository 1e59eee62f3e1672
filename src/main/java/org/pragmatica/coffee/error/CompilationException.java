package org.pragmatica.coffee.error;

/**
 * Thrown by nodes to abandon a compilation. Carries the {@link CompileError} describing the defect.
 */
public final class CompilationException extends RuntimeException {

    private final CompileError error;

    public CompilationException(CompileError error) {
        super(error.message());
        this.error = error;
    }

    public static CompilationException malformed(String node, String reason) {
        return new CompilationException(new CompileError.MalformedTree(node, reason));
    }

    public CompileError error() {
        return error;
    }
}
