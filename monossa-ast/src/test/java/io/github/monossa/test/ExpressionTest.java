package io.github.monossa.test;

import io.github.monossa.ast.BinaryOpKind;
import io.github.monossa.ast.Definition;
import io.github.monossa.ast.Expression;
import io.github.monossa.ast.FunctionDef;
import io.github.monossa.ast.LValue;
import io.github.monossa.ast.Program;
import io.github.monossa.ast.Type;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionTest {
    private static Expression.IntegerLiteral field(long value) {
        return new Expression.IntegerLiteral(value, Type.FIELD);
    }

    @Test
    void testTypes() {
        assertEquals(Type.UNIT, new Expression.Block().type());
        assertEquals(Type.FIELD, new Expression.Block(new Expression.BoolLiteral(true), field(1)).type());
        assertEquals(Type.str(5), new Expression.StrLiteral("hello").type());
        assertEquals(Type.array(2, Type.FIELD),
                new Expression.ArrayLiteral(Arrays.asList(field(1), field(2)), Type.FIELD).type());
        assertEquals(Type.BOOL, new Expression.Binary(field(1), BinaryOpKind.LESS, field(2)).type());
        assertEquals(Type.FIELD, new Expression.Binary(field(1), BinaryOpKind.ADD, field(2)).type());
        assertEquals(Type.tuple(Type.FIELD, Type.BOOL),
                new Expression.Tuple(field(1), new Expression.BoolLiteral(false)).type());
        assertTrue(new Expression.Semi(field(1)).type().isUnit());
        assertTrue(Type.tuple().isUnit());
    }

    @Test
    void testTupleAccess() {
        Expression tuple = new Expression.Tuple(field(1), new Expression.BoolLiteral(false));
        assertEquals(Type.BOOL, new Expression.ExtractTupleField(tuple, 1).type());
        assertThrows(IllegalStateException.class, () -> new Expression.ExtractTupleField(field(1), 0).type());

        Expression.Ident pair = new Expression.Ident(Definition.local(0), "p", Type.tuple(Type.FIELD, Type.BOOL));
        assertEquals(Type.BOOL, new LValue.MemberAccess(new LValue.Ident(pair), 1).type());
    }

    @Test
    void testStrBytes() {
        assertArrayEquals(new byte[]{(byte) 0xC3, (byte) 0xA9}, new Expression.StrLiteral("é").bytes());
        assertEquals(Type.str(2), new Expression.StrLiteral("é").type());
    }

    @Test
    void testNegativeLiteral() {
        assertThrows(IllegalArgumentException.class, () -> field(-1));
    }

    @Test
    void testProgram() {
        FunctionDef main = new FunctionDef(0, "main", Collections.emptyList(), field(0), Type.FIELD);
        FunctionDef other = new FunctionDef(1, "other", Collections.emptyList(), field(1), Type.FIELD);
        Program program = new Program(Arrays.asList(main, other), 0);
        assertSame(main, program.main());
        assertSame(other, program.get(1));
        assertEquals(2, program.size());
        assertThrows(IllegalStateException.class, () -> program.get(7));
        assertThrows(IllegalArgumentException.class, () -> new Program(Arrays.asList(main, main), 0));
        assertThrows(IllegalArgumentException.class, () -> new Program(Collections.singletonList(other), 0));
    }
}
