package org.pragmatica.coffee.ast;

import org.junit.jupiter.api.Test;
import org.pragmatica.coffee.compiler.CompileOptions;
import org.pragmatica.coffee.compiler.Scope;
import org.pragmatica.coffee.error.CompilationException;
import org.pragmatica.coffee.error.CompileError;

import static org.junit.jupiter.api.Assertions.*;

class OpTest {

    private static final Value A = Value.of("a");
    private static final Value B = Value.of("b");

    private static String compile(Node node) {
        return node.compile("", Scope.root(), CompileOptions.NONE);
    }

    // === Conversions ===

    @Test
    void is_compilesToStrictEquality() {
        assertEquals("a === b", compile(Op.binary("is", A, B)));
    }

    @Test
    void aint_compilesToStrictInequality() {
        assertEquals("a !== b", compile(Op.binary("aint", A, B)));
    }

    @Test
    void equality_isMadeStrict() {
        assertEquals("a === b", compile(Op.binary("==", A, B)));
        assertEquals("a !== b", compile(Op.binary("!=", A, B)));
    }

    @Test
    void logicalWords_areConverted() {
        assertEquals("a && b", compile(Op.binary("and", A, B)));
        assertEquals("a || b", compile(Op.binary("or", A, B)));
        assertEquals("!a", compile(Op.unary("not", A)));
    }

    @Test
    void operator_storesConvertedSpelling() {
        assertEquals("===", Op.binary("is", A, B).operator());
    }

    @Test
    void otherOperators_passThrough() {
        assertEquals("a + b", compile(Op.binary("+", A, B)));
        assertEquals("a instanceof b", compile(Op.binary("instanceof", A, B)));
    }

    // === Unary ===

    @Test
    void unary_hasNoSpace() {
        var op = Op.unary("-", A);

        assertTrue(op.isUnary());
        assertEquals("-a", compile(op));
    }

    @Test
    void delete_isSeparatedBySpace() {
        var op = Op.unary("delete", Value.of("obj", Suffix.accessor("key")));

        assertEquals("delete obj.key", compile(op));
    }

    // === Conditional assignment ===

    @Test
    void orAssign_expandsToAssignment() {
        assertEquals("a = a || 1", compile(Op.binary("||=", A, Literal.of("1"))));
    }

    @Test
    void andAssign_expandsToAssignment() {
        assertEquals("a = a && b", compile(Op.binary("&&=", A, B)));
    }

    @Test
    void conditionalAssign_withoutRightOperand_failsFast() {
        var thrown = assertThrows(CompilationException.class, () -> Op.unary("||=", A));

        assertInstanceOf(CompileError.MalformedTree.class, thrown.error());
    }
}
