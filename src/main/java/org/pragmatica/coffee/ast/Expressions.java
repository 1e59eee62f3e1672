package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.CompilerConfig;
import org.pragmatica.coffee.compiler.Scope;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered block of nodes - a program, a function body or a branch of a conditional.
 * Pushes a requested return down to its last node.
 */
public record Expressions(List<Node> nodes) implements Node {

    public Expressions {
        nodes = List.copyOf(nodes);
    }

    public static Expressions of(Node... nodes) {
        return new Expressions(List.of(nodes));
    }

    /**
     * Wrap a node as a block unless it already is one.
     */
    public static Expressions wrap(Node node) {
        return node instanceof Expressions expressions
               ? expressions
               : of(node);
    }

    /**
     * Block with the node added at the end.
     */
    public Expressions append(Node node) {
        var extended = new ArrayList<>(nodes);
        extended.add(node);
        return new Expressions(extended);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
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
    public Node unwrap() {
        return nodes.size() == 1
               ? nodes.get(0)
               : this;
    }

    /**
     * Compile as a whole program with a fresh top-level scope and the default configuration.
     */
    public String rootCompile() {
        return rootCompile(CompilerConfig.DEFAULT);
    }

    /**
     * Compile as a whole program with a fresh top-level scope, wrapped in a safety closure
     * unless the configuration disables it.
     */
    public String rootCompile(CompilerConfig config) {
        var scope = Scope.root(config.temporaryPrefix());
        Identifiers.collect(this)
                   .forEach(scope::reserve);
        var body = compile(TAB, scope, CompileOptions.NONE);
        return config.wrapInClosure()
               ? "(function(){\n" + body + "\n})();"
               : body;
    }

    @Override
    public String compile(String indent, Scope scope, CompileOptions options) {
        return compileBlock(indent, scope, options, true);
    }

    /**
     * Compile every node on its own line.
     *
     * @param terminateLast whether the last line receives its node's terminator
     */
    String compileBlock(String indent, Scope scope, CompileOptions options, boolean terminateLast) {
        var lines = new ArrayList<String>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            var node = nodes.get(i);
            var last = i == nodes.size() - 1;
            var terminator = last && !terminateLast
                             ? ""
                             : node.lineTerminator();
            lines.add(indent + compileLine(node, last, indent, scope, options) + terminator);
        }
        return String.join("\n", lines);
    }

    private static String compileLine(Node node, boolean last, String indent, Scope scope, CompileOptions options) {
        if (!last || !options.returns()) {
            return node.compile(indent, scope, options.plain());
        }
        if (node.isStatement() || node.hasCustomReturn()) {
            return node.compile(indent, scope, options);
        }
        return "return " + node.compile(indent, scope, options.withoutReturn());
    }
}
