package io.github.monossa.ssa;

import java.util.Objects;

/**
 * The type of a single SSA value.
 * <p>
 * Composite types are {@link io.github.monossa.util.Tree trees} of scalar types.
 */
public final class ScalarType {
    public static final ScalarType FIELD = new ScalarType(Kind.FIELD, 0);
    public static final ScalarType BOOL = new ScalarType(Kind.UNSIGNED, 1);
    /**
     * The type of the base address of a block of memory.
     */
    public static final ScalarType REFERENCE = new ScalarType(Kind.REFERENCE, 0);
    /**
     * The type of a reference to a function.
     */
    public static final ScalarType FUNCTION = new ScalarType(Kind.FUNCTION, 0);

    public enum Kind {
        SIGNED,
        UNSIGNED,
        FIELD,
        REFERENCE,
        FUNCTION,
    }

    public final Kind kind;
    /**
     * The width of this type in bits, zero if it has no fixed width.
     */
    public final int bitSize;

    private ScalarType(Kind kind, int bitSize) {
        this.kind = kind;
        this.bitSize = bitSize;
    }

    public static ScalarType signed(int bitSize) {
        checkBitSize(bitSize);
        return new ScalarType(Kind.SIGNED, bitSize);
    }

    public static ScalarType unsigned(int bitSize) {
        checkBitSize(bitSize);
        return bitSize == 1 ? BOOL : new ScalarType(Kind.UNSIGNED, bitSize);
    }

    private static void checkBitSize(int bitSize) {
        if (bitSize <= 0) {
            throw new IllegalArgumentException("Bad bit size: " + bitSize);
        }
    }

    /**
     * Whether values of this type are numbers, which arithmetic and comparisons apply to.
     *
     * @return Whether this is a numeric type.
     */
    public boolean isNumeric() {
        return kind == Kind.SIGNED || kind == Kind.UNSIGNED || kind == Kind.FIELD;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarType)) return false;
        ScalarType that = (ScalarType) o;
        return kind == that.kind && bitSize == that.bitSize;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bitSize);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SIGNED:
                return "i" + bitSize;
            case UNSIGNED:
                return this.equals(BOOL) ? "bool" : "u" + bitSize;
            case FIELD:
                return "field";
            case REFERENCE:
                return "ref";
            case FUNCTION:
                return "fn";
            default:
                throw new AssertionError(kind);
        }
    }
}
