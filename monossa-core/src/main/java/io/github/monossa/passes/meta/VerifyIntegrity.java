package io.github.monossa.passes.meta;

import io.github.monossa.ext.CommonExts;
import io.github.monossa.ops.CommonOps;
import io.github.monossa.passes.InPlaceIRPass;
import io.github.monossa.ssa.BasicBlock;
import io.github.monossa.ssa.Control;
import io.github.monossa.ssa.Effect;
import io.github.monossa.ssa.Function;
import io.github.monossa.ssa.Insn;
import io.github.monossa.ssa.ScalarType;
import io.github.monossa.ssa.Var;
import org.intellij.lang.annotations.PrintFormat;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the structure of a finished function, throwing {@link IllegalStateException} if it is broken.
 * <p>
 * Checked are: every block has a control, owned by it; jumps only target blocks of the function
 * and pass arguments matching the target's parameters; conditions are booleans; returns match
 * the function's return types; instruction arguments are defined before they are used, on every
 * path from the entry; and only blocks that are jumped to with arguments, or the entry block,
 * have parameters.
 * <p>
 * Uses in blocks unreachable from the entry are only checked to be defined somewhere in the function.
 */
public class VerifyIntegrity implements InPlaceIRPass<Function> {
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(Function function) {
        Set<BasicBlock> blockSet = new HashSet<>(function.getBlocks());
        ComputePreds.INSTANCE.runInPlace(function);
        ComputeDoms.INSTANCE.runInPlace(function);

        Map<Var, Def> defined = new HashMap<>();
        for (BasicBlock block : function.getBlocks()) {
            for (Var param : block.getParams()) {
                defined.put(param, new Def(block, -1));
            }
            List<Effect> effects = block.getEffects();
            for (int i = 0; i < effects.size(); i++) {
                for (Var var : effects.get(i).getAssignsTo()) {
                    defined.put(var, new Def(block, i));
                }
            }
        }

        for (BasicBlock block : function.getBlocks()) {
            if (block.getExtOrThrow(CommonExts.OWNING_FUNCTION) != function) {
                throw error(null, "block %s not owned by function %s", block.toTargetString(), function.name);
            }
            if (block != function.getEntry()
                    && !block.getParams().isEmpty()
                    && block.getExtOrThrow(CommonExts.PREDS).isEmpty()) {
                throw error(null, "block %s has parameters, but nothing jumps to it\n  in function: %s",
                        block.toTargetString(), function);
            }

            List<Effect> effects = block.getEffects();
            for (int i = 0; i < effects.size(); i++) {
                Effect effect = effects.get(i);
                if (effect.getExtOrThrow(CommonExts.OWNING_BLOCK) != block) {
                    throw error(effect.insn(), "effect not owned by block\n  effect: %s\n  block: %s", effect, block);
                }
                checkArgsDefined(function, defined, block, i, effect.insn());
            }

            Control control = block.getControl();
            if (control == null) {
                throw error(null, "block not terminated\n  block: %s", block);
            }
            if (control.getExtOrThrow(CommonExts.OWNING_BLOCK) != block) {
                throw error(control.insn(), "control not owned by block\n  control: %s\n  block: %s", control, block);
            }
            checkArgsDefined(function, defined, block, effects.size(), control.insn());
            for (BasicBlock target : control.targets) {
                if (!blockSet.contains(target)) {
                    throw error(control.insn(), "instruction references block not in function" +
                                    "\n  referenced: %s\n  instruction: %s\n  in block: %s",
                            target.toTargetString(), control, block);
                }
            }
            checkControl(function, block, control);
        }
    }

    private void checkControl(Function function, BasicBlock block, Control control) {
        Insn insn = control.insn();
        List<Var> args = insn.args();
        if (insn.op == CommonOps.BR) {
            if (control.targets.size() != 1) {
                throw error(insn, "br with %d targets in block %s", control.targets.size(), block.toTargetString());
            }
            BasicBlock target = control.targets.get(0);
            checkTypes(insn, block, args, target.getParams(), "jump to " + target.toTargetString());
        } else if (insn.op == CommonOps.BR_IF) {
            if (control.targets.size() != 2 || args.size() != 1) {
                throw error(insn, "malformed br_if %s in block %s", control, block.toTargetString());
            }
            if (!args.get(0).type.equals(ScalarType.BOOL)) {
                throw error(insn, "br_if condition %s has type %s in block %s",
                        args.get(0), args.get(0).type, block.toTargetString());
            }
            for (BasicBlock target : control.targets) {
                if (!target.getParams().isEmpty()) {
                    throw error(insn, "br_if in block %s targets %s, which has parameters",
                            block.toTargetString(), target.toTargetString());
                }
            }
        } else if (insn.op == CommonOps.RETURN) {
            if (!control.targets.isEmpty()) {
                throw error(insn, "return with targets in block %s", block.toTargetString());
            }
            List<ScalarType> returnTypes = function.getReturnTypes();
            if (args.size() != returnTypes.size()) {
                throw error(insn, "returning %d values from %s, which returns %d",
                        args.size(), function.name, returnTypes.size());
            }
            for (int i = 0; i < args.size(); i++) {
                if (!args.get(i).type.equals(returnTypes.get(i))) {
                    throw error(insn, "return value %s has type %s, expected %s in block %s",
                            args.get(i), args.get(i).type, returnTypes.get(i), block.toTargetString());
                }
            }
        } else {
            throw error(insn, "unknown control %s in block %s", control, block.toTargetString());
        }
    }

    private void checkTypes(Insn insn, BasicBlock block, List<Var> args, List<Var> params, String what) {
        if (args.size() != params.size()) {
            throw error(insn, "%s passes %d arguments for %d parameters in block %s",
                    what, args.size(), params.size(), block.toTargetString());
        }
        for (int i = 0; i < args.size(); i++) {
            if (!args.get(i).type.equals(params.get(i).type)) {
                throw error(insn, "%s passes %s of type %s for parameter %s of type %s in block %s",
                        what, args.get(i), args.get(i).type, params.get(i), params.get(i).type,
                        block.toTargetString());
            }
        }
    }

    private void checkArgsDefined(Function function, Map<Var, Def> defined, BasicBlock block, int index, Insn insn) {
        boolean reachable = block == function.getEntry() || block.getNullable(CommonExts.IDOM) != null;
        for (Var arg : insn) {
            Def def = defined.get(arg);
            if (def == null) {
                throw error(insn, "%s uses %s, which is not defined in the function\n  in block: %s",
                        insn, arg, block);
            }
            if (!reachable) continue;
            boolean dominated = def.block == block
                    ? def.index < index
                    : ComputeDoms.dominates(def.block, block);
            if (!dominated) {
                throw error(insn, "%s uses %s, which is not defined on every path to it" +
                                "\n  defined in: %s\n  used in: %s",
                        insn, arg, def.block.toTargetString(), block);
            }
        }
    }

    private static final class Def {
        final BasicBlock block;
        final int index; // -1 for block parameters

        Def(BasicBlock block, int index) {
            this.block = block;
            this.index = index;
        }
    }

    private static IllegalStateException error(Insn insn, @PrintFormat String fmt, Object... args) {
        IllegalStateException e = new IllegalStateException(String.format(fmt, args));
        if (insn != null && insn.created != null) {
            e.initCause(insn.created);
        }
        return e;
    }
}
