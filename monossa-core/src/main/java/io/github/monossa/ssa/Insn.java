package io.github.monossa.ssa;

import io.github.monossa.ext.CommonExts;
import io.github.monossa.ext.Ext;
import io.github.monossa.ext.ExtHolder;
import io.github.monossa.ops.Op;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An instruction: an {@link Op operation} applied to argument vars.
 * <p>
 * An instruction does nothing until it is made into an {@link Effect} with {@link #assignTo(List)},
 * or a {@link Control} with {@link #jumpsTo(List)}, and inserted into a block.
 */
public final class Insn extends ExtHolder implements Iterable<Var> {
    public static boolean TRACK_INSN_CREATIONS = System.getenv("MONOSSA_TRACK_INSN_CREATIONS") != null;

    /**
     * Where this instruction was constructed, if {@link #TRACK_INSN_CREATIONS} was set.
     */
    @Nullable
    public final Throwable created = TRACK_INSN_CREATIONS ? new Throwable("constructed") : null;
    public final Op op;
    private final List<Var> args;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    public List<Var> args() {
        return args;
    }

    public Effect assignTo(Var... vars) {
        return assignTo(Arrays.asList(vars));
    }

    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    public Control jumpsTo(BasicBlock... targets) {
        return jumpsTo(Arrays.asList(targets));
    }

    public Control jumpsTo(List<BasicBlock> targets) {
        return new Control(this, targets);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    @NotNull
    @Override
    public Iterator<Var> iterator() {
        return args.iterator();
    }

    // exts
    private Object owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return owner instanceof Effect ? (T) owner : null;
        } else if (ext == CommonExts.OWNING_CONTROL) {
            return owner instanceof Control ? (T) owner : null;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
