package io.github.monossa.test;

import io.github.monossa.ext.CommonExts;
import io.github.monossa.ops.BinaryOp;
import io.github.monossa.ops.CommonOps;
import io.github.monossa.passes.meta.ComputeDoms;
import io.github.monossa.passes.meta.VerifyIntegrity;
import io.github.monossa.ssa.BasicBlock;
import io.github.monossa.ssa.Function;
import io.github.monossa.ssa.FunctionId;
import io.github.monossa.ssa.IRBuilder;
import io.github.monossa.ssa.ScalarType;
import io.github.monossa.ssa.SsaProgram;
import io.github.monossa.ssa.Var;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IRBuilderTest {
    private static Function newFunction(ScalarType... returns) {
        return new Function(new FunctionId(0), "test", Arrays.asList(returns));
    }

    @Test
    void testMax() {
        Function func = newFunction(ScalarType.FIELD);
        IRBuilder ib = new IRBuilder(func);
        Var a = ib.addBlockParameter(func.getEntry(), ScalarType.FIELD);
        Var b = ib.addBlockParameter(func.getEntry(), ScalarType.FIELD);

        BasicBlock takeA = ib.insertBlock();
        BasicBlock takeB = ib.insertBlock();
        BasicBlock end = ib.insertBlock();
        Var result = ib.addBlockParameter(end, ScalarType.FIELD);

        Var bLess = ib.insertBinary(b, BinaryOp.LT, a);
        assertEquals(ScalarType.BOOL, bLess.type);
        ib.terminateWithJmpif(bLess, takeA, takeB);
        ib.switchToBlock(takeA);
        ib.terminateWithJmp(end, Collections.singletonList(a));
        ib.switchToBlock(takeB);
        ib.terminateWithJmp(end, Collections.singletonList(b));
        ib.switchToBlock(end);
        ib.terminateWithReturn(Collections.singletonList(result));

        VerifyIntegrity.INSTANCE.runInPlace(func);
        assertEquals(Arrays.asList(a, b), func.getParams());
    }

    @Test
    void testMemory() {
        Function func = newFunction(ScalarType.unsigned(8));
        IRBuilder ib = new IRBuilder(func);
        Var slots = ib.insertAllocate(2);
        Var value = ib.numericConstant(200, ScalarType.unsigned(8));
        ib.insertStore(ib.insertBinary(slots, BinaryOp.ADD, ib.fieldConstant(1)), value);
        Var loaded = ib.insertLoad(slots, ib.fieldConstant(1), ScalarType.unsigned(8));
        ib.terminateWithReturn(Collections.singletonList(loaded));

        VerifyIntegrity.INSTANCE.runInPlace(func);
        assertEquals(ScalarType.REFERENCE, slots.type);
        assertEquals(1, Utils.effects(func, CommonOps.STORE).size());
        assertThrows(IllegalArgumentException.class, () -> ib.insertAllocate(-1));
    }

    @Test
    void testMalformedArguments() {
        Function func = newFunction();
        IRBuilder ib = new IRBuilder(func);
        BasicBlock target = ib.insertBlock();
        ib.addBlockParameter(target, ScalarType.FIELD);

        assertThrows(IllegalArgumentException.class,
                () -> ib.terminateWithJmp(target, Collections.emptyList()));
        assertThrows(IllegalArgumentException.class,
                () -> ib.terminateWithReturn(Collections.singletonList(ib.fieldConstant(1))));
        assertThrows(IllegalArgumentException.class,
                () -> ib.numericConstant(1, ScalarType.REFERENCE));
        assertThrows(IllegalArgumentException.class,
                () -> ib.insertCallIndirect(ib.fieldConstant(0), Collections.emptyList(), Collections.emptyList()));
    }

    @Test
    void testBlockTerminatedOnce() {
        Function func = newFunction();
        IRBuilder ib = new IRBuilder(func);
        ib.terminateWithReturn(Collections.emptyList());
        assertThrows(IllegalStateException.class, () -> ib.terminateWithReturn(Collections.emptyList()));
        assertThrows(IllegalStateException.class, () -> ib.fieldConstant(1));
    }

    @Test
    void testVerifyRejectsUnterminated() {
        Function func = newFunction();
        IRBuilder ib = new IRBuilder(func);
        ib.insertBlock();
        ib.terminateWithReturn(Collections.emptyList());
        assertThrows(IllegalStateException.class, () -> VerifyIntegrity.INSTANCE.runInPlace(func));
    }

    @Test
    void testVerifyRejectsMistypedJump() {
        Function func = newFunction();
        IRBuilder ib = new IRBuilder(func);
        BasicBlock target = ib.insertBlock();
        ib.addBlockParameter(target, ScalarType.BOOL);
        ib.terminateWithJmp(target, Collections.singletonList(ib.fieldConstant(1)));
        ib.switchToBlock(target);
        ib.terminateWithReturn(Collections.emptyList());
        assertThrows(IllegalStateException.class, () -> VerifyIntegrity.INSTANCE.runInPlace(func));
    }

    @Test
    void testVerifyRejectsForeignVar() {
        Function other = newFunction(ScalarType.FIELD);
        Var foreign = new IRBuilder(other).fieldConstant(1);

        Function func = newFunction(ScalarType.FIELD);
        IRBuilder ib = new IRBuilder(func);
        ib.terminateWithReturn(Collections.singletonList(foreign));
        assertThrows(IllegalStateException.class, () -> VerifyIntegrity.INSTANCE.runInPlace(func));
    }

    @Test
    void testVerifyRejectsUseAcrossBranches() {
        Function func = newFunction(ScalarType.FIELD);
        IRBuilder ib = new IRBuilder(func);
        Var cond = ib.addBlockParameter(func.getEntry(), ScalarType.BOOL);
        BasicBlock left = ib.insertBlock();
        BasicBlock right = ib.insertBlock();
        ib.terminateWithJmpif(cond, left, right);

        ib.switchToBlock(left);
        Var onlyLeft = ib.fieldConstant(2);
        ib.terminateWithReturn(Collections.singletonList(onlyLeft));
        ib.switchToBlock(right);
        ib.terminateWithReturn(Collections.singletonList(onlyLeft));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> VerifyIntegrity.INSTANCE.runInPlace(func));
        assertTrue(e.getMessage().contains("not defined on every path"), e.getMessage());
    }

    @Test
    void testVerifyRejectsUseAfterJoin() {
        Function func = newFunction(ScalarType.FIELD);
        IRBuilder ib = new IRBuilder(func);
        Var cond = ib.addBlockParameter(func.getEntry(), ScalarType.BOOL);
        BasicBlock left = ib.insertBlock();
        BasicBlock right = ib.insertBlock();
        BasicBlock end = ib.insertBlock();
        ib.terminateWithJmpif(cond, left, right);

        ib.switchToBlock(left);
        Var onlyLeft = ib.fieldConstant(2);
        ib.terminateWithJmp(end, Collections.emptyList());
        ib.switchToBlock(right);
        ib.terminateWithJmp(end, Collections.emptyList());
        ib.switchToBlock(end);
        ib.terminateWithReturn(Collections.singletonList(onlyLeft));

        assertThrows(IllegalStateException.class, () -> VerifyIntegrity.INSTANCE.runInPlace(func));
    }

    @Test
    void testDominators() {
        Function func = newFunction();
        IRBuilder ib = new IRBuilder(func);
        Var cond = ib.addBlockParameter(func.getEntry(), ScalarType.BOOL);
        BasicBlock header = ib.insertBlock();
        BasicBlock body = ib.insertBlock();
        BasicBlock exit = ib.insertBlock();
        BasicBlock unreachable = ib.insertBlock();
        ib.terminateWithJmp(header, Collections.emptyList());
        ib.switchToBlock(header);
        ib.terminateWithJmpif(cond, body, exit);
        ib.switchToBlock(body);
        ib.terminateWithJmp(header, Collections.emptyList());
        ib.switchToBlock(exit);
        ib.terminateWithReturn(Collections.emptyList());
        ib.switchToBlock(unreachable);
        ib.terminateWithJmp(exit, Collections.emptyList());

        ComputeDoms.INSTANCE.runInPlace(func);
        assertNull(func.getEntry().getNullable(CommonExts.IDOM));
        assertSame(func.getEntry(), header.getExtOrThrow(CommonExts.IDOM));
        assertSame(header, body.getExtOrThrow(CommonExts.IDOM));
        assertSame(header, exit.getExtOrThrow(CommonExts.IDOM));
        assertNull(unreachable.getNullable(CommonExts.IDOM));
        assertTrue(ComputeDoms.dominates(header, exit));
        assertFalse(ComputeDoms.dominates(body, exit));
        assertFalse(ComputeDoms.dominates(header, unreachable));
    }

    @Test
    void testVerifyAcceptsLoopCarriedParameter() {
        Function func = newFunction(ScalarType.FIELD);
        IRBuilder ib = new IRBuilder(func);
        Var cond = ib.addBlockParameter(func.getEntry(), ScalarType.BOOL);
        BasicBlock header = ib.insertBlock();
        BasicBlock body = ib.insertBlock();
        BasicBlock exit = ib.insertBlock();
        Var acc = ib.addBlockParameter(header, ScalarType.FIELD);
        ib.terminateWithJmp(header, Collections.singletonList(ib.fieldConstant(0)));

        ib.switchToBlock(header);
        ib.terminateWithJmpif(cond, body, exit);
        ib.switchToBlock(body);
        Var next = ib.insertBinary(acc, BinaryOp.ADD, ib.fieldConstant(1));
        ib.terminateWithJmp(header, Collections.singletonList(next));
        ib.switchToBlock(exit);
        ib.terminateWithReturn(Collections.singletonList(acc));

        VerifyIntegrity.INSTANCE.runInPlace(func);
    }

    @Test
    void testCalls() {
        Function func = newFunction(ScalarType.FIELD, ScalarType.BOOL);
        IRBuilder ib = new IRBuilder(func);
        FunctionId callee = new FunctionId(1);
        Var ref = ib.insertFunctionRef(callee);
        assertEquals(ScalarType.FUNCTION, ref.type);
        List<Var> results = ib.insertCallIndirect(ref,
                Collections.singletonList(ib.fieldConstant(3)),
                Arrays.asList(ScalarType.FIELD, ScalarType.BOOL));
        assertEquals(2, results.size());
        ib.terminateWithReturn(results);
        VerifyIntegrity.INSTANCE.runInPlace(func);

        assertSame(ref, Utils.definition(results.get(0)).args().get(0));
    }

    @Test
    void testProgram() {
        SsaProgram program = new SsaProgram(new FunctionId(0));
        Function main = newFunction();
        new IRBuilder(main).terminateWithReturn(Collections.emptyList());
        program.add(main);
        assertSame(main, program.main());
        assertThrows(IllegalStateException.class, () -> program.add(main));
        assertThrows(IllegalStateException.class, () -> program.get(new FunctionId(5)));
    }
}
