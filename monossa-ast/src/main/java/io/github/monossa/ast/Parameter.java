package io.github.monossa.ast;

import java.util.Objects;

/**
 * A function parameter.
 */
public final class Parameter {
    public final int id;
    public final boolean mutable;
    public final String name;
    public final Type type;

    public Parameter(int id, boolean mutable, String name, Type type) {
        this.id = id;
        this.mutable = mutable;
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
    }

    @Override
    public String toString() {
        return (mutable ? "mut " : "") + name + "$" + id + ": " + type;
    }
}
