package org.pragmatica.coffee.compiler;

import org.pragmatica.coffee.error.CompilationException;
import org.pragmatica.coffee.error.CompileError;

/**
 * Result of compiling a program - either the complete target source or the defect that abandoned it.
 */
public sealed interface CompileResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Get the generated source, rethrowing the failure if compilation was abandoned.
     */
    String unwrap();

    /**
     * Compilation finished and produced target source.
     */
    record Success(String source) implements CompileResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String unwrap() {
            return source;
        }
    }

    /**
     * Compilation was abandoned. No partial output is kept.
     */
    record Failure(CompileError error) implements CompileResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public String unwrap() {
            throw new CompilationException(error);
        }
    }
}
