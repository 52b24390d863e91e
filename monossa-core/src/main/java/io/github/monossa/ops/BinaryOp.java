package io.github.monossa.ops;

/**
 * The binary operators of the SSA IR.
 * <p>
 * Source operators with no counterpart here are expressed with these, swapped operands and {@link CommonOps#NOT}.
 */
public enum BinaryOp {
    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    DIV("div"),
    MOD("mod"),
    EQ("eq"),
    LT("lt"),
    AND("and"),
    OR("or"),
    XOR("xor"),
    SHL("shl"),
    SHR("shr"),
    ;

    public final String mnemonic;

    BinaryOp(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    /**
     * Whether this operator always produces a boolean.
     *
     * @return Whether this is a comparison.
     */
    public boolean isComparison() {
        return this == EQ || this == LT;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
