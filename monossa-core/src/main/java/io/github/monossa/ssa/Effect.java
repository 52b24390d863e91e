package io.github.monossa.ssa;

import io.github.monossa.ext.CommonExts;
import io.github.monossa.ext.Ext;
import io.github.monossa.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An effect, encapsulating an {@link Insn instruction}, and the
 * variables its results are assigned to.
 */
public final class Effect extends ExtHolder {
    private final List<Var> assignsTo;
    private final Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        this.assignsTo = Collections.unmodifiableList(new ArrayList<>(assignsTo));
        for (Var var : this.assignsTo) {
            if (var.getNullable(CommonExts.ASSIGNED_AT) != null) {
                throw new IllegalStateException(String.format(
                        "%s is already assigned by %s", var, var.getNullable(CommonExts.ASSIGNED_AT)));
            }
            var.attachExt(CommonExts.ASSIGNED_AT, this);
        }
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        this.insn = insn;
    }

    public List<Var> getAssignsTo() {
        return assignsTo;
    }

    public Insn insn() {
        return insn;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!assignsTo.isEmpty()) {
            sb.append(assignsTo.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "", " = ")));
        }
        sb.append(insn);
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
