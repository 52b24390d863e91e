package io.github.monossa.ext;

import io.github.monossa.ssa.BasicBlock;
import io.github.monossa.ssa.Control;
import io.github.monossa.ssa.Effect;
import io.github.monossa.ssa.Function;

import java.util.List;

/**
 * The exts attached to SSA IR.
 */
public class CommonExts {
    /**
     * On a var: the effect assigning it. Absent for block parameters.
     */
    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");
    /**
     * On a var: the block it is a parameter of. Absent for vars assigned by effects.
     */
    public static final Ext<BasicBlock> PARAMETER_OF = Ext.create(BasicBlock.class, "PARAMETER_OF");

    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");

    /**
     * On a block: the blocks with a control that targets it, computed by
     * {@link io.github.monossa.passes.meta.ComputePreds}.
     */
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");
    /**
     * On a block reachable from the entry, other than the entry: its immediate dominator,
     * computed by {@link io.github.monossa.passes.meta.ComputeDoms}.
     */
    public static final Ext<BasicBlock> IDOM = Ext.create(BasicBlock.class, "IDOM");
}
