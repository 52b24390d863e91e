package io.github.monossa.conf;

/**
 * Options for {@link io.github.monossa.passes.convert.AstToSsa SSA generation}.
 * <p>
 * Defaults come from the environment:
 * <ul>
 *     <li>{@code MONOSSA_VERIFY}: set to {@code false} to skip verifying generated functions.</li>
 *     <li>{@code MONOSSA_MUTABLE_SLOTS}: if set, lower {@code let mut} bindings to memory slots.</li>
 * </ul>
 */
public final class SsaGenOptions {
    /**
     * The options taken from the environment.
     */
    public static final SsaGenOptions DEFAULT = builder().build();

    public final boolean verify;
    public final boolean mutableSlots;

    private SsaGenOptions(Builder builder) {
        this.verify = builder.verify;
        this.mutableSlots = builder.mutableSlots;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .setVerify(verify)
                .setMutableSlots(mutableSlots);
    }

    @Override
    public String toString() {
        return "SsaGenOptions{verify=" + verify + ", mutableSlots=" + mutableSlots + "}";
    }

    public static final class Builder {
        private boolean verify = !"false".equalsIgnoreCase(System.getenv("MONOSSA_VERIFY"));
        private boolean mutableSlots = System.getenv("MONOSSA_MUTABLE_SLOTS") != null;

        private Builder() {
        }

        /**
         * Set whether every generated function should be run through
         * {@link io.github.monossa.passes.meta.VerifyIntegrity}.
         *
         * @param verify Whether to verify.
         * @return This builder.
         */
        public Builder setVerify(boolean verify) {
            this.verify = verify;
            return this;
        }

        /**
         * Set whether {@code let mut} bindings live in memory slots, rather than being renamed on assignment.
         * <p>
         * Renamed bindings are merged through block parameters where branches join and around loops.
         * With slots, assignments store to memory and every read loads from it instead.
         *
         * @param mutableSlots Whether to use slots.
         * @return This builder.
         */
        public Builder setMutableSlots(boolean mutableSlots) {
            this.mutableSlots = mutableSlots;
            return this;
        }

        public SsaGenOptions build() {
            return new SsaGenOptions(this);
        }
    }
}
