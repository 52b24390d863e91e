package io.github.monossa.ops;

import io.github.monossa.ssa.Insn;
import io.github.monossa.ssa.Var;

import java.util.List;

/**
 * An operation, encapsulating an {@link OpKey operation key} and any intermediates.
 */
public class Op {
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    public Insn insn(Var... vars) {
        return new Insn(this, vars);
    }

    public Insn insn(List<Var> vars) {
        return new Insn(this, vars);
    }
}
