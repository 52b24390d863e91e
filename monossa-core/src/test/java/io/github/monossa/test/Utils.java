package io.github.monossa.test;

import io.github.monossa.ast.Definition;
import io.github.monossa.ast.Expression;
import io.github.monossa.ast.FunctionDef;
import io.github.monossa.ast.Parameter;
import io.github.monossa.ast.Program;
import io.github.monossa.ast.Type;
import io.github.monossa.conf.SsaGenOptions;
import io.github.monossa.ext.CommonExts;
import io.github.monossa.ops.CommonOps;
import io.github.monossa.ops.Op;
import io.github.monossa.ops.OpKey;
import io.github.monossa.passes.convert.AstToSsa;
import io.github.monossa.ssa.BasicBlock;
import io.github.monossa.ssa.Effect;
import io.github.monossa.ssa.Function;
import io.github.monossa.ssa.Insn;
import io.github.monossa.ssa.SsaProgram;
import io.github.monossa.ssa.Var;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class Utils {
    public static final SsaGenOptions VERIFIED = SsaGenOptions.builder()
            .setVerify(true)
            .setMutableSlots(false)
            .build();
    public static final SsaGenOptions SLOTS = VERIFIED.toBuilder()
            .setMutableSlots(true)
            .build();

    public static SsaProgram generate(Program program) {
        return new AstToSsa(VERIFIED).run(program);
    }

    /**
     * Generate a program of just main, returning the generated main.
     */
    public static Function generateMain(Expression body, Type returnType, Parameter... params) {
        return generate(new Program(Arrays.asList(fn(0, "main", body, returnType, params)), 0)).main();
    }

    public static FunctionDef fn(int id, String name, Expression body, Type returnType, Parameter... params) {
        return new FunctionDef(id, name, Arrays.asList(params), body, returnType);
    }

    public static Expression.IntegerLiteral field(long value) {
        return new Expression.IntegerLiteral(value, Type.FIELD);
    }

    public static Expression.Ident local(int id, String name, Type type) {
        return new Expression.Ident(Definition.local(id), name, type);
    }

    public static Expression.Ident fnRef(int funcId, String name, Type type) {
        return new Expression.Ident(Definition.function(funcId), name, type);
    }

    /**
     * All instructions of a function's effects, in block order.
     */
    @NotNull
    public static List<Insn> effects(Function func) {
        List<Insn> insns = new ArrayList<>();
        for (BasicBlock block : func.getBlocks()) {
            for (Effect effect : block.getEffects()) {
                insns.add(effect.insn());
            }
        }
        return insns;
    }

    public static List<Insn> effects(Function func, OpKey key) {
        List<Insn> insns = new ArrayList<>();
        for (Insn insn : effects(func)) {
            if (insn.op.key == key) {
                insns.add(insn);
            }
        }
        return insns;
    }

    public static List<Insn> effects(Function func, Op op) {
        return effects(func, op.key);
    }

    public static Insn definition(Var var) {
        return var.getExtOrThrow(CommonExts.ASSIGNED_AT).insn();
    }

    public static Insn returnOf(Function func) {
        for (BasicBlock block : func.getBlocks()) {
            Insn insn = block.getControl().insn();
            if (insn.op.key == CommonOps.RETURN.key) {
                return insn;
            }
        }
        throw new AssertionError("No return in " + func);
    }
}
