package org.pragmatica.coffee.error;

/**
 * Defect detected while compiling a syntax tree.
 * Every variant is a programmer error of the tree producer, never a recoverable condition.
 */
public sealed interface CompileError {

    /**
     * Human-readable description of the defect.
     */
    String message();

    /**
     * A super call compiled outside of any assignment that names its method.
     */
    record NoEnclosingMethod(String arguments) implements CompileError {
        @Override
        public String message() {
            return "No enclosing method context for super(" + arguments + ")";
        }
    }

    /**
     * A node composition that cannot be turned into target source.
     */
    record MalformedTree(String node, String reason) implements CompileError {
        @Override
        public String message() {
            return "Malformed " + node + ": " + reason;
        }
    }
}
