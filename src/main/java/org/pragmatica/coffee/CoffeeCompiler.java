package org.pragmatica.coffee;

import org.pragmatica.coffee.ast.Expressions;
import org.pragmatica.coffee.ast.Node;
import org.pragmatica.coffee.compiler.CompileResult;
import org.pragmatica.coffee.compiler.CompilerConfig;
import org.pragmatica.coffee.error.CompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for compiling syntax trees into JavaScript source.
 *
 * <p>Example usage:
 * <pre>{@code
 * var program = Expressions.of(Assign.of("answer", Literal.of("42")));
 *
 * var source = CoffeeCompiler.compileProgram(program).unwrap();
 * }</pre>
 */
public final class CoffeeCompiler {
    private static final Logger log = LoggerFactory.getLogger(CoffeeCompiler.class);

    private final CompilerConfig config;

    private CoffeeCompiler(CompilerConfig config) {
        this.config = config;
    }

    /**
     * Create a compiler with the default configuration.
     */
    public static CoffeeCompiler create() {
        return create(CompilerConfig.DEFAULT);
    }

    /**
     * Create a compiler with custom configuration.
     */
    public static CoffeeCompiler create(CompilerConfig config) {
        return new CoffeeCompiler(config);
    }

    /**
     * Compile a program with the default configuration.
     */
    public static CompileResult compileProgram(Node root) {
        return create().compile(root);
    }

    public CompilerConfig config() {
        return config;
    }

    /**
     * Compile a program: a fresh top-level scope, no return or assignment intent, and the
     * safety closure unless disabled. Either the whole program compiles or nothing is returned.
     *
     * @param root program block, or a single node treated as a one-line program
     * @return generated source, or the defect that abandoned compilation
     */
    public CompileResult compile(Node root) {
        var program = Expressions.wrap(root);
        log.debug("Compiling program of {} top-level expressions", program.nodes().size());
        try {
            var source = program.rootCompile(config);
            log.debug("Compiled program into {} characters", source.length());
            return new CompileResult.Success(source);
        } catch (CompilationException e) {
            log.warn("Compilation abandoned: {}", e.getMessage());
            return new CompileResult.Failure(e.error());
        }
    }

    /**
     * Create a builder for a configured compiler.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean wrapInClosure = CompilerConfig.DEFAULT.wrapInClosure();
        private String temporaryPrefix = CompilerConfig.DEFAULT.temporaryPrefix();

        private Builder() {}

        public Builder wrapInClosure(boolean wrap) {
            this.wrapInClosure = wrap;
            return this;
        }

        public Builder temporaryPrefix(String prefix) {
            this.temporaryPrefix = prefix;
            return this;
        }

        public CoffeeCompiler build() {
            return create(new CompilerConfig(wrapInClosure, temporaryPrefix));
        }
    }
}
