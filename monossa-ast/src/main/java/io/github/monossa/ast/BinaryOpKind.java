package io.github.monossa.ast;

/**
 * The binary operators of the source language.
 */
public enum BinaryOpKind {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    AND("&"),
    OR("|"),
    XOR("^"),
    SHIFT_LEFT("<<"),
    SHIFT_RIGHT(">>"),
    ;

    public final String symbol;

    BinaryOpKind(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Whether this operator compares its operands, producing a boolean.
     *
     * @return Whether this is a comparison.
     */
    public boolean isComparator() {
        switch (this) {
            case EQUAL:
            case NOT_EQUAL:
            case LESS:
            case LESS_EQUAL:
            case GREATER:
            case GREATER_EQUAL:
                return true;
            default:
                return false;
        }
    }
}
