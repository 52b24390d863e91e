package io.github.monossa.passes.convert;

import io.github.monossa.ssa.IRBuilder;
import io.github.monossa.ssa.ScalarType;
import io.github.monossa.ssa.Var;

import java.util.Objects;

/**
 * A single value produced while translating an expression; the leaf type of value {@link io.github.monossa.util.Tree trees}.
 * <p>
 * A value is either {@link Normal}, an SSA var that can be used directly, or {@link Mutable},
 * a memory slot which must be {@link #eval(IRBuilder) evaluated} to read its current contents.
 * Values are never evaluated implicitly.
 */
public abstract class Value {
    private Value() {
    }

    public static Value normal(Var var) {
        return new Normal(var);
    }

    /**
     * Create a value which lives in a memory slot.
     *
     * @param address The address of the slot.
     * @param type    The type of the value in the slot.
     * @return The value.
     * @throws IllegalStateException If the address is not a reference.
     */
    public static Value mutable(Var address, ScalarType type) {
        return new Mutable(address, type);
    }

    /**
     * Get a var holding this value, inserting a load at the builder if it is in memory.
     * <p>
     * This has no effect other than possibly reading memory.
     *
     * @param builder The builder to insert any instructions with.
     * @return The var.
     */
    public abstract Var eval(IRBuilder builder);

    public abstract ScalarType type();

    public static final class Normal extends Value {
        public final Var var;

        private Normal(Var var) {
            this.var = Objects.requireNonNull(var);
        }

        @Override
        public Var eval(IRBuilder builder) {
            return var;
        }

        @Override
        public ScalarType type() {
            return var.type;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Normal && ((Normal) o).var == var;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(var);
        }

        @Override
        public String toString() {
            return var.toString();
        }
    }

    public static final class Mutable extends Value {
        public final Var address;
        public final ScalarType type;

        private Mutable(Var address, ScalarType type) {
            if (address.type.kind != ScalarType.Kind.REFERENCE) {
                throw new IllegalStateException(String.format(
                        "Mutable value at %s, which is a %s, not a reference", address, address.type));
            }
            this.address = address;
            this.type = Objects.requireNonNull(type);
        }

        @Override
        public Var eval(IRBuilder builder) {
            return builder.insertLoad(address, builder.fieldConstant(0), type);
        }

        @Override
        public ScalarType type() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Mutable && ((Mutable) o).address == address;
        }

        @Override
        public int hashCode() {
            return ~System.identityHashCode(address);
        }

        @Override
        public String toString() {
            return "*" + address;
        }
    }
}
