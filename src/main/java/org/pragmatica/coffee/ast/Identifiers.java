package org.pragmatica.coffee.ast;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Collects every identifier a program names: variables, loop variables, parameters and
 * caught errors. Minted temporaries must avoid all of them, including names assigned only
 * after the temporary is issued.
 */
final class Identifiers {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private final Set<String> names = new LinkedHashSet<>();

    private Identifiers() {}

    static Set<String> collect(Node root) {
        var identifiers = new Identifiers();
        identifiers.visit(root);
        return identifiers.names;
    }

    private void visit(Node node) {
        if (node instanceof Expressions block) {
            visitAll(block.nodes());
        } else if (node instanceof Literal literal) {
            add(literal.value());
        } else if (node instanceof Return ret) {
            visit(ret.expression());
        } else if (node instanceof Throw error) {
            visit(error.expression());
        } else if (node instanceof Call call) {
            if (call.callee() instanceof Call.Callee.Named named) {
                visit(named.node());
            }
            visitAll(call.arguments());
        } else if (node instanceof Value value) {
            visit(value.base());
            value.suffixes().forEach(this::visitSuffix);
        } else if (node instanceof Assign assign) {
            visit(assign.target());
            visit(assign.value());
        } else if (node instanceof Op op) {
            visit(op.first());
            op.second().ifPresent(this::visit);
        } else if (node instanceof Code code) {
            code.parameters().forEach(this::add);
            visit(code.body());
        } else if (node instanceof ObjectLiteral object) {
            object.properties().forEach(property -> visit(property.value()));
        } else if (node instanceof ArrayLiteral array) {
            visitAll(array.elements());
        } else if (node instanceof While loop) {
            visit(loop.condition());
            visit(loop.body());
        } else if (node instanceof For loop) {
            add(loop.name());
            loop.index().ifPresent(this::add);
            visit(loop.source());
            visit(loop.body());
        } else if (node instanceof Try block) {
            visit(block.attempt());
            block.error().ifPresent(this::add);
            block.recovery().ifPresent(this::visit);
            block.ensure().ifPresent(this::visit);
        } else if (node instanceof Parenthetical group) {
            visit(group.expressions());
        } else if (node instanceof If conditional) {
            visit(conditional.condition());
            visit(conditional.body());
            conditional.elseBody().ifPresent(this::visit);
        }
    }

    private void visitAll(List<? extends Node> nodes) {
        nodes.forEach(this::visit);
    }

    // accessor names are properties, not variables
    private void visitSuffix(Suffix suffix) {
        if (suffix instanceof Suffix.Index index) {
            visit(index.index());
        } else if (suffix instanceof Suffix.Slice slice) {
            visit(slice.from());
            visit(slice.to());
        }
    }

    private void add(String candidate) {
        if (IDENTIFIER.matcher(candidate).matches()) {
            names.add(candidate);
        }
    }
}
