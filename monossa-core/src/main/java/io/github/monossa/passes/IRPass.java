package io.github.monossa.passes;

import io.github.monossa.passes.misc.ChainedPass;

/**
 * A pass over IR, or a conversion from one kind of IR to another.
 *
 * @param <A> The type of the input.
 * @param <B> The type of the output.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Whether this pass modifies its input and returns it, rather than producing new IR.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
