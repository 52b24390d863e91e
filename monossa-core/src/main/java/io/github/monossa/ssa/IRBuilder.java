package io.github.monossa.ssa;

import io.github.monossa.ops.BinaryOp;
import io.github.monossa.ops.CommonOps;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * An IR, or instruction, builder, which encapsulates a position in a function
 * where instructions are being inserted.
 * <p>
 * Every instruction is appended to the end of whichever block the builder is positioned
 * at when it is inserted.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private BasicBlock bb;

    /**
     * Construct an instruction builder, inserting into the entry block of a function.
     *
     * @param func The function.
     */
    public IRBuilder(Function func) {
        this(func, func.getEntry());
    }

    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    /**
     * Get the block this builder is inserting at the end of.
     *
     * @return The block.
     */
    public BasicBlock getBlock() {
        return bb;
    }

    /**
     * Set the block this builder should insert at the end of.
     *
     * @param bb The block.
     */
    public void switchToBlock(BasicBlock bb) {
        this.bb = bb;
    }

    /**
     * Create a new block in the function, without moving the builder.
     *
     * @return The block.
     */
    public BasicBlock insertBlock() {
        return func.newBb();
    }

    public Var addBlockParameter(BasicBlock block, ScalarType type) {
        Var param = func.newVar("p", type);
        block.addParam(param);
        return param;
    }

    public void insert(Effect effect) {
        bb.addEffect(effect);
    }

    /**
     * Assign the result of the instruction to a new variable,
     * and insert the effect.
     *
     * @param insn The instruction.
     * @param name The name of the variable.
     * @param type The type of the result.
     * @return The assigned variable.
     */
    public Var insert(Insn insn, String name, ScalarType type) {
        Var v = func.newVar(name, type);
        insert(insn.assignTo(v));
        return v;
    }

    /**
     * Assign the results of the instruction to new variables, one of each type,
     * and insert the effect.
     *
     * @param insn  The instruction.
     * @param name  The name of the variables.
     * @param types The types of the results.
     * @return The assigned variables.
     */
    public List<Var> insert(Insn insn, String name, List<ScalarType> types) {
        List<Var> vars = new ArrayList<>(types.size());
        for (ScalarType type : types) {
            vars.add(func.newVar(name, type));
        }
        insert(insn.assignTo(vars));
        return vars;
    }

    public void insertCtrl(Control ctrl) {
        bb.setControl(ctrl);
    }

    public ScalarType typeOf(Var value) {
        return value.type;
    }

    public Var numericConstant(BigInteger value, ScalarType type) {
        if (!type.isNumeric()) {
            throw new IllegalArgumentException("Numeric constant of non-numeric type " + type);
        }
        return insert(CommonOps.constant(value), "k", type);
    }

    public Var numericConstant(long value, ScalarType type) {
        return numericConstant(BigInteger.valueOf(value), type);
    }

    public Var fieldConstant(long value) {
        return numericConstant(value, ScalarType.FIELD);
    }

    /**
     * Allocate a contiguous block of slots.
     *
     * @param size The number of slots.
     * @return The address of the first slot.
     */
    public Var insertAllocate(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Negative allocation size " + size);
        }
        return insert(CommonOps.ALLOCATE.create(size).insn(), "alloc", ScalarType.REFERENCE);
    }

    public void insertStore(Var address, Var value) {
        insert(CommonOps.STORE.insn(address, value).assignTo());
    }

    public Var insertLoad(Var address, Var offset, ScalarType type) {
        return insert(CommonOps.LOAD.insn(address, offset), "ld", type);
    }

    /**
     * Insert a binary operation.
     * <p>
     * Comparisons produce a boolean, everything else has the type of its left operand.
     *
     * @param lhs The left operand.
     * @param op  The operator.
     * @param rhs The right operand.
     * @return The result.
     */
    public Var insertBinary(Var lhs, BinaryOp op, Var rhs) {
        ScalarType type = op.isComparison() ? ScalarType.BOOL : lhs.type;
        return insert(CommonOps.binary(lhs, op, rhs), op.mnemonic, type);
    }

    public Var insertNot(Var value) {
        return insert(CommonOps.NOT.insn(value), "not", value.type);
    }

    public Var insertCast(Var value, ScalarType type) {
        return insert(CommonOps.CAST.create(type).insn(value), "cast", type);
    }

    public void insertConstrain(Var condition) {
        insert(CommonOps.CONSTRAIN.insn(condition).assignTo());
    }

    public List<Var> insertCall(FunctionId function, List<Var> args, List<ScalarType> resultTypes) {
        return insert(CommonOps.CALL.create(function).insn(args), "ret", resultTypes);
    }

    public List<Var> insertCallIndirect(Var callee, List<Var> args, List<ScalarType> resultTypes) {
        if (callee.type.kind != ScalarType.Kind.FUNCTION) {
            throw new IllegalArgumentException(String.format("Callee %s has non-function type %s", callee, callee.type));
        }
        List<Var> insnArgs = new ArrayList<>(args.size() + 1);
        insnArgs.add(callee);
        insnArgs.addAll(args);
        return insert(CommonOps.CALL_INDIRECT.insn(insnArgs), "ret", resultTypes);
    }

    public Var insertFunctionRef(FunctionId function) {
        return insert(CommonOps.FUNC_REF.create(function).insn(), "fn", ScalarType.FUNCTION);
    }

    /**
     * Terminate the current block with an unconditional jump.
     *
     * @param target The block to jump to.
     * @param args   The arguments to pass, one for each parameter of the target.
     * @throws IllegalArgumentException If the number of arguments is wrong.
     */
    public void terminateWithJmp(BasicBlock target, List<Var> args) {
        if (args.size() != target.getParams().size()) {
            throw new IllegalArgumentException(String.format(
                    "Jump from %s to %s passes %d arguments, but the target has %d parameters",
                    bb.toTargetString(), target.toTargetString(), args.size(), target.getParams().size()));
        }
        insertCtrl(Control.br(target, args));
    }

    public void terminateWithJmpif(Var condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        insertCtrl(Control.brIf(condition, thenBlock, elseBlock));
    }

    /**
     * Terminate the current block by returning from the function.
     *
     * @param values The values to return, one for each of the function's return types.
     * @throws IllegalArgumentException If the number of values is wrong.
     */
    public void terminateWithReturn(List<Var> values) {
        if (values.size() != func.getReturnTypes().size()) {
            throw new IllegalArgumentException(String.format(
                    "Returning %d values from %s, which returns %d",
                    values.size(), func.name, func.getReturnTypes().size()));
        }
        insertCtrl(Control.ret(values));
    }
}
