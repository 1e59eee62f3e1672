package org.pragmatica.coffee.ast;

import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;
import org.pragmatica.coffee.error.CompilationException;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Array comprehension, compiled into an indexed loop over the materialized source.
 * When its value is returned or assigned, the loop collects every iteration's result
 * into an array and delivers that array itself.
 *
 * @param body   expression evaluated for every element
 * @param source iterated array
 * @param name   element variable
 * @param index  optional index variable
 */
public record For(Node body, Node source, String name, Optional<String> index) implements Node {

    public For {
        if (name == null || name.isBlank()) {
            throw CompilationException.malformed("comprehension", "element variable must not be blank");
        }
        if (index.filter(String::isBlank).isPresent()) {
            throw CompilationException.malformed("comprehension", "index variable must not be blank");
        }
        body = body.unwrap();
        if (body instanceof Expressions block && block.isEmpty()) {
            throw CompilationException.malformed("comprehension", "body must not be empty");
        }
    }

    public static For of(Node body, Node source, String name) {
        return new For(body, source, name, Optional.empty());
    }

    public static For of(Node body, Node source, String name, String index) {
        return new For(body, source, name, Optional.of(index));
    }

    @Override
    public boolean isStatement() {
        return true;
    }

    @Override
    public boolean hasCustomReturn() {
        return true;
    }

    @Override
    public boolean hasCustomAssign() {
        return true;
    }

    @Override
    public String lineTerminator() {
        return "";
    }

    @Override
    public String compile(String indent, Scope scope, CompileOptions options) {
        var sourceVar = scope.freshTemporary();
        var indexVar = scope.freshTemporary();
        var lengthVar = scope.freshTemporary();
        var inner = indent + TAB;

        var namePart = declaration(scope, name);
        var indexPart = index.map(variable -> inner + declaration(scope, variable) + " = " + indexVar + ";\n")
                             .orElse("");
        var sourcePart = "var " + sourceVar + " = " + source.compile(indent, scope, options.plain()) + ";";
        var loopPart = "var " + indexVar + "=0, " + lengthVar + "=" + sourceVar + ".length; "
                       + indexVar + "<" + lengthVar + "; " + indexVar + "++";
        var elementPart = "\n" + inner + namePart + " = " + sourceVar + "[" + indexVar + "];\n";

        var collects = options.returns() || options.assign().isPresent();
        var resultVar = collects
                        ? Optional.of(scope.freshTemporary())
                        : Optional.<String>empty();
        var setResult = resultVar.map(result -> "var " + result + " = [];\n" + indent)
                                 .orElse("");
        var saveResult = resultVar.map(result -> result + "[" + indexVar + "] = ");
        var deliverResult = resultVar.map(result -> "\n" + indent + deliver(result, options))
                                     .orElse("");

        var bodyPart = compileBody(inner, scope, options, saveResult);
        return sourcePart + "\n" + indent + setResult + "for (" + loopPart + ") {" + elementPart + indexPart
               + bodyPart + "\n" + indent + "}" + deliverResult;
    }

    private static String declaration(Scope scope, String variable) {
        return scope.declareIfAbsent(variable)
               ? variable
               : "var " + variable;
    }

    // leading expressions of a block run as statements, only the last one is collected
    private String compileBody(String inner, Scope scope, CompileOptions options, Optional<String> saveResult) {
        var lines = new ArrayList<String>();
        var last = body;
        if (body instanceof Expressions block) {
            var nodes = block.nodes();
            for (var node : nodes.subList(0, nodes.size() - 1)) {
                lines.add(inner + node.compile(inner, scope, options.plain()) + node.lineTerminator());
            }
            last = nodes.get(nodes.size() - 1);
        }
        var compiled = last.compile(inner, scope, options.plain());
        var terminator = saveResult.isPresent()
                         ? ";"
                         : last.lineTerminator();
        lines.add(inner + saveResult.orElse("") + compiled + terminator);
        return String.join("\n", lines);
    }

    private static String deliver(String result, CompileOptions options) {
        var delivered = options.assign()
                               .map(target -> target + " = " + result)
                               .orElse(result);
        if (!options.returns()) {
            return delivered;
        }
        // an assignment is terminated by the enclosing Assign line
        return options.assign().isPresent()
               ? "return " + delivered
               : "return " + delivered + ";";
    }
}
