package io.github.monossa.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * An operation key with a single intermediate of type {@code T}.
 *
 * @param <T> The type of the intermediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    public class UnaryOp extends Op {
        public final T arg;

        private UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    @Nullable
    public UnaryOp checkNullable(Op op) {
        if (op.key == this) {
            @SuppressWarnings("unchecked")
            UnaryOp ret = (UnaryOp) op;
            return ret;
        }
        return null;
    }

    /**
     * Get the intermediate of an op, if it is of this key.
     *
     * @param op The op.
     * @return The intermediate, or null if the op has a different key.
     */
    @Nullable
    public T argNullable(Op op) {
        UnaryOp unary = checkNullable(op);
        return unary == null ? null : unary.arg;
    }

    public Optional<UnaryOp> check(Op op) {
        return Optional.ofNullable(checkNullable(op));
    }

    public UnaryOp cast(Op op) {
        return check(op).orElseThrow(() -> new IllegalArgumentException(op + " is not " + mnemonic));
    }

    public UnaryOp create(T arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Argument is null");
        }
        return new UnaryOp(arg);
    }
}
