package io.github.monossa.passes.convert;

import io.github.monossa.ast.Definition;
import io.github.monossa.ast.Expression;
import io.github.monossa.ast.LValue;
import io.github.monossa.ast.Type;
import io.github.monossa.ops.BinaryOp;
import io.github.monossa.ssa.BasicBlock;
import io.github.monossa.ssa.FunctionId;
import io.github.monossa.ssa.IRBuilder;
import io.github.monossa.ssa.ScalarType;
import io.github.monossa.ssa.Var;
import io.github.monossa.util.Tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Translates the expressions of a single function body, inserting at the builder of its {@link FunctionContext}.
 * <p>
 * Every expression evaluates to a tree of {@link Value}s shaped like its type. Subexpressions are translated
 * left to right, so their effects appear in source order.
 */
public final class ExpressionTranslator implements Expression.Visitor<Tree<Value>> {
    private final FunctionContext ctx;
    private final IRBuilder builder;

    public ExpressionTranslator(FunctionContext ctx) {
        this.ctx = ctx;
        this.builder = ctx.builder;
    }

    public Tree<Value> translate(Expression expr) {
        return expr.accept(this);
    }

    /**
     * Translate an expression that has a single value, and resolve it.
     *
     * @param expr The expression.
     * @return The var holding its value.
     * @throws IllegalStateException If the expression has a composite value.
     */
    public Var translateNonTuple(Expression expr) {
        return translate(expr).getLeaf().eval(builder);
    }

    @Override
    public Tree<Value> visitIdent(Expression.Ident ident) {
        if (ident.definition instanceof Definition.Local) {
            return ctx.lookup(((Definition.Local) ident.definition).id);
        }
        FunctionId id = ctx.driver.getOrQueueFunction(((Definition.Function) ident.definition).funcId);
        return Tree.leaf(Value.normal(builder.insertFunctionRef(id)));
    }

    @Override
    public Tree<Value> visitLiteral(Expression.Literal literal) {
        if (literal instanceof Expression.IntegerLiteral) {
            Expression.IntegerLiteral lit = (Expression.IntegerLiteral) literal;
            ScalarType type = FunctionContext.convertNonTupleType(lit.type);
            return Tree.leaf(Value.normal(builder.numericConstant(lit.value, type)));
        } else if (literal instanceof Expression.BoolLiteral) {
            boolean value = ((Expression.BoolLiteral) literal).value;
            return Tree.leaf(Value.normal(builder.numericConstant(value ? 1 : 0, ScalarType.BOOL)));
        } else if (literal instanceof Expression.StrLiteral) {
            byte[] bytes = ((Expression.StrLiteral) literal).bytes();
            List<Tree<Value>> elements = new ArrayList<>(bytes.length);
            for (byte b : bytes) {
                elements.add(Tree.leaf(Value.normal(builder.fieldConstant(b & 0xFF))));
            }
            return codegenArray(elements, Tree.leaf(ScalarType.FIELD));
        } else if (literal instanceof Expression.ArrayLiteral) {
            Expression.ArrayLiteral lit = (Expression.ArrayLiteral) literal;
            List<Tree<Value>> elements = new ArrayList<>(lit.contents.size());
            for (Expression element : lit.contents) {
                elements.add(ctx.resolve(translate(element)));
            }
            return codegenArray(elements, FunctionContext.convertType(lit.elementType));
        }
        throw new IllegalStateException("Unknown literal " + literal);
    }

    /**
     * Allocate slots for every leaf of every element, and store the elements in order.
     */
    private Tree<Value> codegenArray(List<Tree<Value>> elements, Tree<ScalarType> elementType) {
        long size = (long) elementType.sizeOfType() * elements.size();
        if (size > Integer.MAX_VALUE) {
            throw new IllegalStateException(String.format(
                    "Cannot allocate %d slots for an array, it does not fit in 32 bits", size));
        }
        Var array = builder.insertAllocate((int) size);
        long offset = 0;
        for (Tree<Value> element : elements) {
            for (Value leaf : element) {
                Var address = ctx.makeOffset(array, offset++);
                builder.insertStore(address, leaf.eval(builder));
            }
        }
        return Tree.leaf(Value.normal(array));
    }

    @Override
    public Tree<Value> visitBlock(Expression.Block block) {
        Tree<Value> result = FunctionContext.unitValue();
        for (Expression expr : block.expressions) {
            result = translate(expr);
        }
        return result;
    }

    @Override
    public Tree<Value> visitUnary(Expression.Unary unary) {
        Var rhs = translateNonTuple(unary.rhs);
        switch (unary.operator) {
            case NOT:
                return Tree.leaf(Value.normal(builder.insertNot(rhs)));
            case MINUS:
                Var zero = builder.numericConstant(0, builder.typeOf(rhs));
                return Tree.leaf(Value.normal(builder.insertBinary(zero, BinaryOp.SUB, rhs)));
            default:
                throw new IllegalStateException("Unknown unary operator " + unary.operator);
        }
    }

    @Override
    public Tree<Value> visitBinary(Expression.Binary binary) {
        Var lhs = translateNonTuple(binary.lhs);
        Var rhs = translateNonTuple(binary.rhs);
        return Tree.leaf(Value.normal(ctx.insertBinary(lhs, binary.operator, rhs)));
    }

    @Override
    public Tree<Value> visitIndex(Expression.Index index) {
        Var array = translateNonTuple(index.collection);
        Var elementIndex = translateNonTuple(index.index);
        return codegenIndex(array, elementIndex, index.elementType);
    }

    private Var elementBase(Var elementIndex, int elementSize) {
        return builder.insertBinary(elementIndex, BinaryOp.MUL, builder.fieldConstant(elementSize));
    }

    private Tree<Value> codegenIndex(Var array, Var elementIndex, Type elementType) {
        Tree<ScalarType> types = FunctionContext.convertType(elementType);
        Var base = elementBase(elementIndex, types.sizeOfType());
        long[] leaf = {0};
        return types.map(type -> {
            Var offset = ctx.makeOffset(base, leaf[0]++);
            return Value.normal(builder.insertLoad(array, offset, type));
        });
    }

    @Override
    public Tree<Value> visitCast(Expression.Cast cast) {
        Var lhs = translateNonTuple(cast.lhs);
        return Tree.leaf(Value.normal(builder.insertCast(lhs, FunctionContext.convertNonTupleType(cast.type))));
    }

    @Override
    public Tree<Value> visitFor(Expression.For forExpr) {
        Var start = translateNonTuple(forExpr.startRange);
        Var end = translateNonTuple(forExpr.endRange);

        BasicBlock header = builder.insertBlock();
        BasicBlock body = builder.insertBlock();
        BasicBlock exit = builder.insertBlock();

        Var index = builder.addBlockParameter(header, FunctionContext.convertNonTupleType(forExpr.indexType));
        List<Var> entryArgs = new ArrayList<>();
        entryArgs.add(start);

        // locals renamed in the body are carried around the loop as header parameters
        List<Integer> carried = new ArrayList<>();
        for (int id : AssignedLocals.in(forExpr.block)) {
            Tree<Value> value = ctx.lookupNullable(id);
            if (value == null || !isRenamed(value)) continue;
            carried.add(id);
            entryArgs.addAll(ctx.evalAll(value));
            ctx.define(id, value.map(leaf -> Value.normal(builder.addBlockParameter(header, leaf.type()))));
        }
        builder.terminateWithJmp(header, entryArgs);

        builder.switchToBlock(header);
        ctx.define(forExpr.indexVariable, Tree.leaf(Value.normal(index)));
        Var inRange = builder.insertBinary(index, BinaryOp.LT, end);
        builder.terminateWithJmpif(inRange, body, exit);
        Map<Integer, Tree<Value>> atHeader = ctx.saveScope();

        builder.switchToBlock(body);
        translate(forExpr.block);
        List<Var> backArgs = new ArrayList<>();
        backArgs.add(builder.insertBinary(index, BinaryOp.ADD, builder.numericConstant(1, index.type)));
        for (int id : carried) {
            backArgs.addAll(ctx.evalAll(ctx.lookup(id)));
        }
        builder.terminateWithJmp(header, backArgs);

        ctx.restoreScope(atHeader);
        builder.switchToBlock(exit);
        return FunctionContext.unitValue();
    }

    /**
     * Whether assignments to a local rename it, rather than storing to its slots.
     */
    private static boolean isRenamed(Tree<Value> value) {
        List<Value> leaves = value.flatten();
        return !leaves.isEmpty() && leaves.get(0) instanceof Value.Normal;
    }

    @Override
    public Tree<Value> visitIf(Expression.If ifExpr) {
        Var condition = translateNonTuple(ifExpr.condition);

        BasicBlock thenBlock = builder.insertBlock();
        BasicBlock elseBlock = builder.insertBlock();
        builder.terminateWithJmpif(condition, thenBlock, elseBlock);
        Map<Integer, Tree<Value>> before = ctx.saveScope();

        builder.switchToBlock(thenBlock);
        List<Var> thenArgs = ctx.evalAll(translate(ifExpr.consequence));
        BasicBlock thenEnd = builder.getBlock();
        Map<Integer, Tree<Value>> afterThen = ctx.saveScope();
        ctx.restoreScope(before);

        List<Var> elseArgs;
        BasicBlock elseEnd;
        Map<Integer, Tree<Value>> afterElse;
        if (ifExpr.alternative == null) {
            if (!thenArgs.isEmpty()) {
                throw new IllegalStateException(String.format(
                        "If without else has a value of type %s", ifExpr.consequence.type()));
            }
            elseArgs = new ArrayList<>();
            elseEnd = elseBlock;
            afterElse = before;
        } else {
            builder.switchToBlock(elseBlock);
            elseArgs = ctx.evalAll(translate(ifExpr.alternative));
            elseEnd = builder.getBlock();
            afterElse = ctx.saveScope();
            ctx.restoreScope(before);
        }

        List<Integer> renamed = new ArrayList<>();
        for (int id : new TreeSet<>(before.keySet())) {
            Tree<Value> old = before.get(id);
            if (!old.equals(afterThen.get(id)) || !old.equals(afterElse.get(id))) {
                renamed.add(id);
            }
        }

        if (ifExpr.alternative == null && renamed.isEmpty()) {
            builder.switchToBlock(thenEnd);
            builder.terminateWithJmp(elseBlock, Collections.emptyList());
            builder.switchToBlock(elseBlock);
            return FunctionContext.unitValue();
        }

        BasicBlock endBlock = builder.insertBlock();
        Tree<Value> result = ctx.mapType(ifExpr.type,
                type -> Value.normal(builder.addBlockParameter(endBlock, type)));
        // renamed values are always normal, so evaluating them inserts nothing
        for (int id : renamed) {
            thenArgs.addAll(ctx.evalAll(afterThen.get(id)));
            elseArgs.addAll(ctx.evalAll(afterElse.get(id)));
            ctx.define(id, before.get(id).map(leaf -> Value.normal(builder.addBlockParameter(endBlock, leaf.type()))));
        }

        builder.switchToBlock(thenEnd);
        builder.terminateWithJmp(endBlock, thenArgs);
        builder.switchToBlock(elseEnd);
        builder.terminateWithJmp(endBlock, elseArgs);

        builder.switchToBlock(endBlock);
        return result;
    }

    @Override
    public Tree<Value> visitTuple(Expression.Tuple tuple) {
        List<Tree<Value>> elements = new ArrayList<>(tuple.elements.size());
        for (Expression element : tuple.elements) {
            elements.add(ctx.resolve(translate(element)));
        }
        return Tree.branch(elements);
    }

    @Override
    public Tree<Value> visitExtractTupleField(Expression.ExtractTupleField extract) {
        return translate(extract.tuple).get(extract.index);
    }

    @Override
    public Tree<Value> visitCall(Expression.Call call) {
        List<ScalarType> resultTypes = FunctionContext.convertType(call.returnType).flatten();
        List<Var> results;
        if (call.func instanceof Expression.Ident
                && ((Expression.Ident) call.func).definition instanceof Definition.Function) {
            int sourceId = ((Definition.Function) ((Expression.Ident) call.func).definition).funcId;
            FunctionId callee = ctx.driver.getOrQueueFunction(sourceId);
            results = builder.insertCall(callee, translateArguments(call.arguments), resultTypes);
        } else {
            Var callee = translateNonTuple(call.func);
            results = builder.insertCallIndirect(callee, translateArguments(call.arguments), resultTypes);
        }
        List<Value> values = new ArrayList<>(results.size());
        for (Var result : results) {
            values.add(Value.normal(result));
        }
        return FunctionContext.convertType(call.returnType).reshape(values);
    }

    private List<Var> translateArguments(List<Expression> arguments) {
        List<Var> args = new ArrayList<>();
        for (Expression argument : arguments) {
            args.addAll(ctx.evalAll(translate(argument)));
        }
        return args;
    }

    @Override
    public Tree<Value> visitLet(Expression.Let let) {
        Tree<Value> value = translate(let.expression);
        if (let.mutable && ctx.driver.options.mutableSlots) {
            value = ctx.allocateSlots(value);
        } else {
            value = ctx.resolve(value);
        }
        ctx.define(let.id, value);
        return FunctionContext.unitValue();
    }

    @Override
    public Tree<Value> visitConstrain(Expression.Constrain constrain) {
        builder.insertConstrain(translateNonTuple(constrain.expression));
        return FunctionContext.unitValue();
    }

    @Override
    public Tree<Value> visitAssign(Expression.Assign assign) {
        Tree<Value> rhs = translate(assign.expression);

        List<Integer> path = new ArrayList<>();
        LValue lvalue = assign.lvalue;
        while (lvalue instanceof LValue.MemberAccess) {
            path.add(0, ((LValue.MemberAccess) lvalue).fieldIndex);
            lvalue = ((LValue.MemberAccess) lvalue).object;
        }

        if (lvalue instanceof LValue.Index) {
            LValue.Index index = (LValue.Index) lvalue;
            Var array = readLValue(index.array).getLeaf().eval(builder);
            Var elementIndex = translateNonTuple(index.index);
            Tree<ScalarType> elementType = FunctionContext.convertType(index.elementType);
            Var base = elementBase(elementIndex, elementType.sizeOfType());
            long leaf = leafOffset(elementType, path);
            for (Value v : rhs) {
                Var address = builder.insertBinary(array, BinaryOp.ADD, ctx.makeOffset(base, leaf++));
                builder.insertStore(address, v.eval(builder));
            }
            return FunctionContext.unitValue();
        }

        int id = localId(((LValue.Ident) lvalue).ident);
        Tree<Value> current = ctx.lookup(id);
        Tree<Value> target = current;
        for (int field : path) {
            target = target.get(field);
        }

        List<Value> slots = target.flatten();
        if (!slots.isEmpty() && slots.get(0) instanceof Value.Mutable) {
            List<Var> values = ctx.evalAll(rhs);
            if (values.size() != slots.size()) {
                throw new IllegalStateException(String.format(
                        "Assigning %d values to %s, which has %d", values.size(), assign.lvalue, slots.size()));
            }
            for (int i = 0; i < slots.size(); i++) {
                builder.insertStore(((Value.Mutable) slots.get(i)).address, values.get(i));
            }
        } else {
            ctx.define(id, current.replace(path, ctx.resolve(rhs)));
        }
        return FunctionContext.unitValue();
    }

    /**
     * Count the leaves of a type that come before the subtree at a path.
     */
    private static long leafOffset(Tree<ScalarType> type, List<Integer> path) {
        long offset = 0;
        for (int field : path) {
            for (int i = 0; i < field; i++) {
                offset += type.get(i).sizeOfType();
            }
            type = type.get(field);
        }
        return offset;
    }

    /**
     * Read the current value of an lvalue, as if it were an expression.
     */
    private Tree<Value> readLValue(LValue lvalue) {
        if (lvalue instanceof LValue.Ident) {
            return ctx.lookup(localId(((LValue.Ident) lvalue).ident));
        } else if (lvalue instanceof LValue.MemberAccess) {
            LValue.MemberAccess access = (LValue.MemberAccess) lvalue;
            return readLValue(access.object).get(access.fieldIndex);
        } else if (lvalue instanceof LValue.Index) {
            LValue.Index index = (LValue.Index) lvalue;
            Var array = readLValue(index.array).getLeaf().eval(builder);
            Var elementIndex = translateNonTuple(index.index);
            return codegenIndex(array, elementIndex, index.elementType);
        }
        throw new IllegalStateException("Unknown lvalue " + lvalue);
    }

    private static int localId(Expression.Ident ident) {
        if (!(ident.definition instanceof Definition.Local)) {
            throw new IllegalStateException("Cannot assign to " + ident.definition);
        }
        return ((Definition.Local) ident.definition).id;
    }

    @Override
    public Tree<Value> visitSemi(Expression.Semi semi) {
        translate(semi.expression);
        return FunctionContext.unitValue();
    }
}
