package org.pragmatica.coffee.ast;

import org.junit.jupiter.api.Test;
import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;
import org.pragmatica.coffee.error.CompilationException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ForTest {

    private static For doubled(Node source) {
        return For.of(Op.binary("*", Value.of("x"), Literal.of("2")), source, "x");
    }

    @Test
    void withReturn_collectsAndReturnsResultArray() {
        var source = ArrayLiteral.of(Literal.of("1"), Literal.of("2"), Literal.of("3"));

        var compiled = doubled(source).compile("", Scope.root(), CompileOptions.NONE.withReturn());

        assertEquals("""
            var _a = [1, 2, 3];
            var _d = [];
            for (var _b=0, _c=_a.length; _b<_c; _b++) {
              var x = _a[_b];
              _d[_b] = x * 2;
            }
            return _d;""", compiled);
    }

    @Test
    void withoutReturnOrAssign_runsForSideEffectsOnly() {
        var loop = For.of(Call.of(Value.of("print"), Value.of("x")), Value.of("list"), "x");

        var compiled = loop.compile("", Scope.root(), CompileOptions.NONE);

        assertEquals("""
            var _a = list;
            for (var _b=0, _c=_a.length; _b<_c; _b++) {
              var x = _a[_b];
              print(x);
            }""", compiled);
    }

    @Test
    void indexVariable_isBoundToCounter() {
        var loop = For.of(Call.of(Value.of("print"), Value.of("x"), Value.of("i")), Value.of("list"), "x", "i");

        var compiled = loop.compile("", Scope.root(), CompileOptions.NONE);

        assertThat(compiled).contains("  var x = _a[_b];\n  var i = _b;\n  print(x, i);");
    }

    @Test
    void declaredElementVariable_isReused() {
        var scope = Scope.root();
        scope.declare("x");

        var compiled = doubled(Value.of("list")).compile("", scope, CompileOptions.NONE);

        assertThat(compiled).contains("\n  x = _a[_b];")
                            .doesNotContain("var x");
    }

    @Test
    void temporaries_avoidDeclaredNames() {
        var scope = Scope.root();
        scope.declare("_a");

        var compiled = doubled(Value.of("list")).compile("", scope, CompileOptions.NONE);

        assertThat(compiled).startsWith("var _b = list;");
    }

    @Test
    void multiExpressionBody_collectsLastExpressionOnly() {
        var body = Expressions.of(Call.of(Value.of("log"), Value.of("x")),
                                  Op.binary("+", Value.of("x"), Literal.of("1")));
        var loop = For.of(body, Value.of("list"), "x");

        var compiled = loop.compile("", Scope.root(), CompileOptions.NONE.withReturn());

        assertThat(compiled).contains("  log(x);\n  _d[_b] = x + 1;\n}");
    }

    @Test
    void functionBody_returnsComprehension() {
        var function = Code.of(List.of("list"), doubled(Value.of("list")));

        var compiled = function.compile("", Scope.root(), CompileOptions.NONE);

        assertEquals("""
            function(list) {
              var _a = list;
              var _d = [];
              for (var _b=0, _c=_a.length; _b<_c; _b++) {
                var x = _a[_b];
                _d[_b] = x * 2;
              }
              return _d;
            }""", compiled);
    }

    @Test
    void assignmentInReturnPosition_assignsAndReturns() {
        var block = Expressions.of(Assign.of("squares", doubled(Value.of("list"))));

        var compiled = block.compile("", Scope.root(), CompileOptions.NONE.withReturn());

        assertThat(compiled).startsWith("var squares;\nvar _a = list;")
                            .endsWith("}\nreturn squares = _d;");
    }

    @Test
    void flags_declareStatementWithCustomReturnAndAssign() {
        var loop = doubled(Value.of("list"));

        assertTrue(loop.isStatement());
        assertTrue(loop.hasCustomReturn());
        assertTrue(loop.hasCustomAssign());
        assertEquals("", loop.lineTerminator());
    }

    @Test
    void blankElementVariable_failsFast() {
        assertThrows(CompilationException.class, () -> For.of(Value.of("x"), Value.of("list"), " "));
    }

    @Test
    void emptyBody_failsFast() {
        assertThrows(CompilationException.class, () -> For.of(Expressions.of(), Value.of("list"), "x"));
    }

    @Test
    void explicitReturn_terminatesReturnLineOnce() {
        var function = Code.of(List.of("list"), Return.of(doubled(Value.of("list"))));

        var compiled = function.compile("", Scope.root(), CompileOptions.NONE);

        assertFalse(compiled.contains(";;"));
        assertEquals("""
            function(list) {
              var _a = list;
              var _d = [];
              for (var _b=0, _c=_a.length; _b<_c; _b++) {
                var x = _a[_b];
                _d[_b] = x * 2;
              }
              return _d;
            }""", compiled);
    }

    @Test
    void temporaries_avoidNamesAssignedLaterInNestedFunction() {
        var reset = Call.of(Code.of(List.of(), Assign.of("_a", Literal.of("0"))));
        var loop = For.of(Expressions.of(reset, Value.of("x")), Value.of("list"), "x");

        var compiled = Expressions.of(loop).rootCompile();

        assertThat(compiled).contains("var _b = list;")
                            .contains("for (var _c=0, _d=_b.length; _c<_d; _c++) {")
                            .contains("var _a = 0;")
                            .doesNotContain("var _a = list;");
    }
}
