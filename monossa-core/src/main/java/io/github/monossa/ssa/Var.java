package io.github.monossa.ssa;

import io.github.monossa.ext.CommonExts;
import io.github.monossa.ext.Ext;
import io.github.monossa.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A typed SSA value, defined exactly once: either assigned by an {@link Effect},
 * or as a parameter of a {@link BasicBlock}.
 */
public final class Var extends ExtHolder {
    public final String name;
    public final int index;
    public final ScalarType type;

    public Var(String name, int index, ScalarType type) {
        this.name = name;
        this.index = index;
        this.type = Objects.requireNonNull(type);
    }

    @Override
    public String toString() {
        return '$' + name + (index == 0 ? "" : "." + index);
    }

    // exts
    private Effect assignedAt = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            return (T) assignedAt;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = (Effect) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = null;
            return;
        }
        super.removeExt(ext);
    }
}
