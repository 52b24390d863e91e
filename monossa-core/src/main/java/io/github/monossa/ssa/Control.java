package io.github.monossa.ssa;

import io.github.monossa.ext.CommonExts;
import io.github.monossa.ext.Ext;
import io.github.monossa.ext.ExtHolder;
import io.github.monossa.ops.CommonOps;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A control instruction, terminating a block: an {@link Insn instruction}
 * and the blocks it may jump to.
 */
public final class Control extends ExtHolder {
    private final Insn insn;
    /**
     * The jump targets of this instruction. The meaning of the order depends on the instruction.
     */
    public final List<BasicBlock> targets;

    Control(Insn insn, List<BasicBlock> targets) {
        insn.attachExt(CommonExts.OWNING_CONTROL, this);
        this.insn = insn;
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
    }

    /**
     * Construct an unconditional jump, passing arguments to the target's parameters.
     *
     * @param target The jump target.
     * @param args   The arguments, one for each parameter of the target.
     * @return The jump.
     */
    public static Control br(BasicBlock target, List<Var> args) {
        return CommonOps.BR.insn(args).jumpsTo(target);
    }

    /**
     * Construct a conditional jump.
     *
     * @param cond     The boolean condition.
     * @param ifTrue   The block to jump to if the condition is true.
     * @param ifFalse  The block to jump to otherwise.
     * @return The jump.
     */
    public static Control brIf(Var cond, BasicBlock ifTrue, BasicBlock ifFalse) {
        return CommonOps.BR_IF.insn(cond).jumpsTo(ifTrue, ifFalse);
    }

    public static Control ret(List<Var> values) {
        return CommonOps.RETURN.insn(values).jumpsTo();
    }

    public Insn insn() {
        return insn;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(insn);
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.toTargetString());
            }
        }
        return sb.toString();
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
