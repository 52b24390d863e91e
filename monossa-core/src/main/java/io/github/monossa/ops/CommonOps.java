package io.github.monossa.ops;

import io.github.monossa.ssa.FunctionId;
import io.github.monossa.ssa.Insn;
import io.github.monossa.ssa.ScalarType;
import io.github.monossa.ssa.Var;

import java.math.BigInteger;

/**
 * The {@link Op}s and {@link OpKey}s of the SSA IR.
 * <p>
 * Result types are not part of the instruction; they are the types of the vars it is assigned to.
 */
public class CommonOps {
    /**
     * Control: an unconditional jump to its single target, passing its arguments to the target's parameters.
     */
    public static final Op BR = new SimpleOpKey("br").create();
    /**
     * Control: jumps to its first target if its boolean argument is true, to its second otherwise.
     */
    public static final Op BR_IF = new SimpleOpKey("br_if").create();
    /**
     * Control: returns its arguments from the function.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();

    /**
     * Effect: returns the constant, as the type of the var it is assigned to.
     */
    public static final UnaryOpKey<BigInteger> CONST = new UnaryOpKey<>("const");

    /**
     * Effect: allocates the given number of contiguous slots, returning the address of the first.
     */
    public static final UnaryOpKey<Integer> ALLOCATE = new UnaryOpKey<>("allocate");
    /**
     * Effect: (address, offset) loads the slot at {@code address + offset}.
     */
    public static final Op LOAD = new SimpleOpKey("load").create();
    /**
     * Effect: (address, value) stores the value in the slot at the address, returns nothing.
     */
    public static final Op STORE = new SimpleOpKey("store").create();

    /**
     * Effect: (lhs, rhs) applies the binary operator.
     */
    public static final UnaryOpKey<BinaryOp> BINARY = new UnaryOpKey<>("binary");
    /**
     * Effect: the logical or bitwise complement of its argument.
     */
    public static final Op NOT = new SimpleOpKey("not").create();
    /**
     * Effect: converts its argument to the given type.
     */
    public static final UnaryOpKey<ScalarType> CAST = new UnaryOpKey<>("cast");
    /**
     * Effect: asserts that its boolean argument is true, returns nothing.
     */
    public static final Op CONSTRAIN = new SimpleOpKey("constrain").create();

    /**
     * Effect: calls the function with its arguments, returning one value for each leaf of its return type.
     */
    public static final UnaryOpKey<FunctionId> CALL = new UnaryOpKey<>("call");
    /**
     * Effect: (callee, args...) calls the function its first argument refers to.
     */
    public static final Op CALL_INDIRECT = new SimpleOpKey("call_indirect").create();
    /**
     * Effect: returns a reference to the function.
     */
    public static final UnaryOpKey<FunctionId> FUNC_REF = new UnaryOpKey<>("func_ref");

    public static Insn constant(BigInteger k) {
        return CONST.create(k).insn();
    }

    public static Insn binary(Var lhs, BinaryOp op, Var rhs) {
        return BINARY.create(op).insn(lhs, rhs);
    }
}
