package io.github.monossa.passes.convert;

import io.github.monossa.ast.BinaryOpKind;
import io.github.monossa.ast.FunctionDef;
import io.github.monossa.ast.Parameter;
import io.github.monossa.ast.Type;
import io.github.monossa.ops.BinaryOp;
import io.github.monossa.ssa.Function;
import io.github.monossa.ssa.FunctionId;
import io.github.monossa.ssa.IRBuilder;
import io.github.monossa.ssa.ScalarType;
import io.github.monossa.ssa.Var;
import io.github.monossa.util.F;
import io.github.monossa.util.Tree;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The state of translating a single function: its builder, and the values of its locals in scope.
 */
public final class FunctionContext {
    final ProgramDriver driver;
    final IRBuilder builder;
    private final Map<Integer, Tree<Value>> definitions = new HashMap<>();

    FunctionContext(ProgramDriver driver, FunctionId id, FunctionDef def) {
        this.driver = driver;
        Function func = new Function(id, def.name, convertType(def.returnType).flatten());
        this.builder = new IRBuilder(func);
        addParameters(def.parameters);
    }

    private void addParameters(List<Parameter> parameters) {
        for (Parameter param : parameters) {
            Tree<Value> value = mapType(param.type,
                    type -> Value.normal(builder.addBlockParameter(builder.func.getEntry(), type)));
            if (param.mutable && driver.options.mutableSlots) {
                value = allocateSlots(value);
            }
            define(param.id, value);
        }
    }

    /**
     * Return the value of the body from wherever the builder ended up, completing the function.
     *
     * @param result The value of the body.
     * @return The function.
     */
    Function finish(Tree<Value> result) {
        builder.terminateWithReturn(evalAll(result));
        return builder.func;
    }

    void define(int id, Tree<Value> value) {
        definitions.put(id, value);
    }

    Tree<Value> lookup(int id) {
        Tree<Value> value = definitions.get(id);
        if (value == null) {
            throw new IllegalStateException(String.format(
                    "Local %d is not defined in %s", id, builder.func.name));
        }
        return value;
    }

    @Nullable
    Tree<Value> lookupNullable(int id) {
        return definitions.get(id);
    }

    /**
     * Copy the locals currently in scope, to be restored when leaving a branch or loop body.
     *
     * @return The copy.
     */
    Map<Integer, Tree<Value>> saveScope() {
        return new HashMap<>(definitions);
    }

    void restoreScope(Map<Integer, Tree<Value>> scope) {
        definitions.clear();
        definitions.putAll(scope);
    }

    static Tree<Value> unitValue() {
        return Tree.empty();
    }

    /**
     * Convert a source type to the tree of scalar types of its values.
     * <p>
     * Arrays and strings are a single reference to their slots.
     *
     * @param type The source type.
     * @return The scalar types.
     */
    static Tree<ScalarType> convertType(Type type) {
        if (type instanceof Type.Tuple) {
            List<Tree<ScalarType>> elements = new ArrayList<>();
            for (Type element : ((Type.Tuple) type).elements) {
                elements.add(convertType(element));
            }
            return Tree.branch(elements);
        }
        if (type instanceof Type.Unit) {
            return Tree.empty();
        }
        return Tree.leaf(convertNonTupleType(type));
    }

    static ScalarType convertNonTupleType(Type type) {
        if (type instanceof Type.Field) {
            return ScalarType.FIELD;
        } else if (type instanceof Type.Bool) {
            return ScalarType.BOOL;
        } else if (type instanceof Type.Integer) {
            Type.Integer integer = (Type.Integer) type;
            return integer.signed ? ScalarType.signed(integer.bitSize) : ScalarType.unsigned(integer.bitSize);
        } else if (type instanceof Type.Array || type instanceof Type.Str) {
            return ScalarType.REFERENCE;
        } else if (type instanceof Type.Function) {
            return ScalarType.FUNCTION;
        }
        throw new IllegalStateException("Expected a single value type, found " + type);
    }

    Tree<Value> mapType(Type type, F<ScalarType, Value> f) {
        return convertType(type).map(f);
    }

    List<Var> evalAll(Tree<Value> value) {
        List<Var> vars = new ArrayList<>();
        for (Value leaf : value) {
            vars.add(leaf.eval(builder));
        }
        return vars;
    }

    /**
     * Resolve every leaf to a var, so the result no longer depends on the contents of memory.
     *
     * @param value The value.
     * @return The value, with only normal leaves.
     */
    Tree<Value> resolve(Tree<Value> value) {
        return value.map(leaf -> leaf instanceof Value.Normal ? leaf : Value.normal(leaf.eval(builder)));
    }

    /**
     * Move every leaf of a value into a fresh slot of its own.
     *
     * @param value The value.
     * @return The value, with only mutable leaves.
     */
    Tree<Value> allocateSlots(Tree<Value> value) {
        return value.map(leaf -> {
            Var resolved = leaf.eval(builder);
            Var slot = builder.insertAllocate(1);
            builder.insertStore(slot, resolved);
            return Value.mutable(slot, resolved.type);
        });
    }

    Var makeOffset(Var base, long offset) {
        return builder.insertBinary(base, BinaryOp.ADD, builder.fieldConstant(offset));
    }

    /**
     * Insert a source binary operator, in terms of the operators the IR has.
     *
     * @param lhs The left operand.
     * @param op  The source operator.
     * @param rhs The right operand.
     * @return The result.
     */
    Var insertBinary(Var lhs, BinaryOpKind op, Var rhs) {
        BinaryOp ssaOp;
        boolean swap = false;
        boolean not = false;
        switch (op) {
            case ADD:
                ssaOp = BinaryOp.ADD;
                break;
            case SUBTRACT:
                ssaOp = BinaryOp.SUB;
                break;
            case MULTIPLY:
                ssaOp = BinaryOp.MUL;
                break;
            case DIVIDE:
                ssaOp = BinaryOp.DIV;
                break;
            case MODULO:
                ssaOp = BinaryOp.MOD;
                break;
            case EQUAL:
                ssaOp = BinaryOp.EQ;
                break;
            case NOT_EQUAL:
                ssaOp = BinaryOp.EQ;
                not = true;
                break;
            case LESS:
                ssaOp = BinaryOp.LT;
                break;
            case LESS_EQUAL:
                // a <= b == !(b < a)
                ssaOp = BinaryOp.LT;
                swap = true;
                not = true;
                break;
            case GREATER:
                ssaOp = BinaryOp.LT;
                swap = true;
                break;
            case GREATER_EQUAL:
                ssaOp = BinaryOp.LT;
                not = true;
                break;
            case AND:
                ssaOp = BinaryOp.AND;
                break;
            case OR:
                ssaOp = BinaryOp.OR;
                break;
            case XOR:
                ssaOp = BinaryOp.XOR;
                break;
            case SHIFT_LEFT:
                ssaOp = BinaryOp.SHL;
                break;
            case SHIFT_RIGHT:
                ssaOp = BinaryOp.SHR;
                break;
            default:
                throw new IllegalStateException("Unknown binary operator " + op);
        }
        Var result = swap
                ? builder.insertBinary(rhs, ssaOp, lhs)
                : builder.insertBinary(lhs, ssaOp, rhs);
        return not ? builder.insertNot(result) : result;
    }
}
