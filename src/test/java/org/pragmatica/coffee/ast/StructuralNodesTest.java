package org.pragmatica.coffee.ast;

import org.junit.jupiter.api.Test;
import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;
import org.pragmatica.coffee.error.CompilationException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class StructuralNodesTest {

    private static String compile(Node node) {
        return node.compile("", Scope.root(), CompileOptions.NONE);
    }

    // === Object ===

    @Test
    void object_emitsOnePropertyPerLine() {
        var object = ObjectLiteral.of(Assign.property("name", Literal.of("\"cat\"")),
                                      Assign.property("legs", Literal.of("4")));

        assertEquals("{\n  name: \"cat\",\n  legs: 4\n}", compile(object));
    }

    @Test
    void object_methodResolvesSuperFromPropertyName() {
        var object = ObjectLiteral.of(Assign.property("speak", Code.of(List.of(), Call.superCall())));

        assertEquals("""
            {
              speak: function() {
                return this.constructor.prototype.speak.call(this);
              }
            }""", compile(object));
    }

    @Test
    void object_empty() {
        assertEquals("{}", compile(ObjectLiteral.of()));
    }

    @Test
    void object_propertiesNeverDeclareVariables() {
        var scope = Scope.root();

        ObjectLiteral.of(Assign.property("x", Literal.of("1")))
                     .compile("", scope, CompileOptions.NONE);

        assertThat(scope.variables()).isEmpty();
    }

    @Test
    void object_rejectsVariableAssignment() {
        assertThrows(CompilationException.class,
                     () -> ObjectLiteral.of(Assign.of("x", Literal.of("1"))));
    }

    // === Array ===

    @Test
    void array_joinsElements() {
        var array = ArrayLiteral.of(Literal.of("1"), Value.of("a"), Op.binary("+", Value.of("b"), Literal.of("2")));

        assertEquals("[1, a, b + 2]", compile(array));
    }

    @Test
    void array_empty() {
        assertEquals("[]", compile(ArrayLiteral.of()));
    }

    // === Parenthetical ===

    @Test
    void parenthetical_wrapsExpression() {
        var grouped = Parenthetical.of(Op.binary("+", Value.of("a"), Value.of("b")));

        assertEquals("(a + b) * c", compile(Op.binary("*", grouped, Value.of("c"))));
    }

    @Test
    void parenthetical_noParen_emitsBareExpression() {
        var grouped = Parenthetical.of(Op.binary("+", Value.of("a"), Value.of("b")));

        var source = grouped.compile("", Scope.root(), CompileOptions.NONE.withNoParen());

        assertEquals("a + b", source);
    }

    @Test
    void parenthetical_aroundConditional_compilesTernary() {
        var grouped = Parenthetical.of(If.of(Value.of("a"), Value.of("b"), Value.of("c")));

        assertEquals("(a ? b : c)", compile(grouped));
    }

    @Test
    void parenthetical_block_omitsLastTerminator() {
        var grouped = Parenthetical.of(Value.of("a"), Value.of("b"));

        assertEquals("(a;\nb)", compile(grouped));
    }
}
