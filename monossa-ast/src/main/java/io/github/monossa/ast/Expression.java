package io.github.monossa.ast;

import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An expression of the monomorphized program.
 * <p>
 * Expressions form an immutable tree, and each reports its statically known {@link #type()}.
 */
public abstract class Expression {
    private Expression() {
    }

    /**
     * Get the static type of this expression.
     *
     * @return The type.
     */
    public abstract Type type();

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * A visitor over the kinds of expression.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitIdent(Ident ident);

        R visitLiteral(Literal literal);

        R visitBlock(Block block);

        R visitUnary(Unary unary);

        R visitBinary(Binary binary);

        R visitIndex(Index index);

        R visitCast(Cast cast);

        R visitFor(For forExpr);

        R visitIf(If ifExpr);

        R visitTuple(Tuple tuple);

        R visitExtractTupleField(ExtractTupleField extract);

        R visitCall(Call call);

        R visitLet(Let let);

        R visitConstrain(Constrain constrain);

        R visitAssign(Assign assign);

        R visitSemi(Semi semi);
    }

    public static final class Ident extends Expression {
        public final Definition definition;
        public final String name;
        public final Type type;

        public Ident(Definition definition, String name, Type type) {
            this.definition = Objects.requireNonNull(definition);
            this.name = Objects.requireNonNull(name);
            this.type = Objects.requireNonNull(type);
        }

        @Override
        public Type type() {
            return type;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdent(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A literal; one of {@link IntegerLiteral}, {@link BoolLiteral}, {@link StrLiteral} or {@link ArrayLiteral}.
     */
    public static abstract class Literal extends Expression {
        private Literal() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    public static final class IntegerLiteral extends Literal {
        public final BigInteger value;
        public final Type type;

        public IntegerLiteral(BigInteger value, Type type) {
            if (value.signum() < 0) {
                throw new IllegalArgumentException("Integer literals are unsigned, got " + value);
            }
            this.value = value;
            this.type = Objects.requireNonNull(type);
        }

        public IntegerLiteral(long value, Type type) {
            this(BigInteger.valueOf(value), type);
        }

        @Override
        public Type type() {
            return type;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    public static final class BoolLiteral extends Literal {
        public final boolean value;

        public BoolLiteral(boolean value) {
            this.value = value;
        }

        @Override
        public Type type() {
            return Type.BOOL;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    public static final class StrLiteral extends Literal {
        public final String value;

        public StrLiteral(String value) {
            this.value = Objects.requireNonNull(value);
        }

        public byte[] bytes() {
            return value.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public Type type() {
            return Type.str(bytes().length);
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    public static final class ArrayLiteral extends Literal {
        public final List<Expression> contents;
        public final Type elementType;

        public ArrayLiteral(List<Expression> contents, Type elementType) {
            this.contents = Collections.unmodifiableList(contents);
            this.elementType = Objects.requireNonNull(elementType);
        }

        @Override
        public Type type() {
            return Type.array(contents.size(), elementType);
        }

        @Override
        public String toString() {
            return contents.toString();
        }
    }

    public static final class Block extends Expression {
        public final List<Expression> expressions;

        public Block(List<Expression> expressions) {
            this.expressions = Collections.unmodifiableList(expressions);
        }

        public Block(Expression... expressions) {
            this(Arrays.asList(expressions));
        }

        @Override
        public Type type() {
            return expressions.isEmpty()
                    ? Type.UNIT
                    : expressions.get(expressions.size() - 1).type();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("{");
            for (Expression expression : expressions) {
                sb.append(' ').append(expression);
            }
            return sb.append(" }").toString();
        }
    }

    public static final class Unary extends Expression {
        public final UnaryOp operator;
        public final Expression rhs;

        public Unary(UnaryOp operator, Expression rhs) {
            this.operator = Objects.requireNonNull(operator);
            this.rhs = Objects.requireNonNull(rhs);
        }

        @Override
        public Type type() {
            return rhs.type();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }

        @Override
        public String toString() {
            return operator.symbol + rhs;
        }
    }

    public static final class Binary extends Expression {
        public final Expression lhs;
        public final BinaryOpKind operator;
        public final Expression rhs;

        public Binary(Expression lhs, BinaryOpKind operator, Expression rhs) {
            this.lhs = Objects.requireNonNull(lhs);
            this.operator = Objects.requireNonNull(operator);
            this.rhs = Objects.requireNonNull(rhs);
        }

        @Override
        public Type type() {
            return operator.isComparator() ? Type.BOOL : lhs.type();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public String toString() {
            return "(" + lhs + " " + operator.symbol + " " + rhs + ")";
        }
    }

    public static final class Index extends Expression {
        public final Expression collection;
        public final Expression index;
        public final Type elementType;

        public Index(Expression collection, Expression index, Type elementType) {
            this.collection = Objects.requireNonNull(collection);
            this.index = Objects.requireNonNull(index);
            this.elementType = Objects.requireNonNull(elementType);
        }

        @Override
        public Type type() {
            return elementType;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndex(this);
        }

        @Override
        public String toString() {
            return collection + "[" + index + "]";
        }
    }

    public static final class Cast extends Expression {
        public final Expression lhs;
        public final Type type;

        public Cast(Expression lhs, Type type) {
            this.lhs = Objects.requireNonNull(lhs);
            this.type = Objects.requireNonNull(type);
        }

        @Override
        public Type type() {
            return type;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCast(this);
        }

        @Override
        public String toString() {
            return "(" + lhs + " as " + type + ")";
        }
    }

    /**
     * A loop over {@code start..end}, binding the index to {@link #indexVariable} in the body.
     */
    public static final class For extends Expression {
        public final int indexVariable;
        public final String indexName;
        public final Type indexType;
        public final Expression startRange;
        public final Expression endRange;
        public final Expression block;

        public For(int indexVariable, String indexName, Type indexType,
                   Expression startRange, Expression endRange, Expression block) {
            this.indexVariable = indexVariable;
            this.indexName = Objects.requireNonNull(indexName);
            this.indexType = Objects.requireNonNull(indexType);
            this.startRange = Objects.requireNonNull(startRange);
            this.endRange = Objects.requireNonNull(endRange);
            this.block = Objects.requireNonNull(block);
        }

        @Override
        public Type type() {
            return Type.UNIT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFor(this);
        }

        @Override
        public String toString() {
            return "for " + indexName + " in " + startRange + ".." + endRange + " " + block;
        }
    }

    public static final class If extends Expression {
        public final Expression condition;
        public final Expression consequence;
        @Nullable
        public final Expression alternative;
        public final Type type;

        public If(Expression condition, Expression consequence, @Nullable Expression alternative, Type type) {
            this.condition = Objects.requireNonNull(condition);
            this.consequence = Objects.requireNonNull(consequence);
            this.alternative = alternative;
            this.type = Objects.requireNonNull(type);
        }

        @Override
        public Type type() {
            return type;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public String toString() {
            return "if " + condition + " " + consequence + (alternative == null ? "" : " else " + alternative);
        }
    }

    public static final class Tuple extends Expression {
        public final List<Expression> elements;

        public Tuple(List<Expression> elements) {
            this.elements = Collections.unmodifiableList(elements);
        }

        public Tuple(Expression... elements) {
            this(Arrays.asList(elements));
        }

        @Override
        public Type type() {
            List<Type> types = new ArrayList<>();
            for (Expression element : elements) {
                types.add(element.type());
            }
            return Type.tuple(types);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTuple(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < elements.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(elements.get(i));
            }
            return sb.append(")").toString();
        }
    }

    public static final class ExtractTupleField extends Expression {
        public final Expression tuple;
        public final int index;

        public ExtractTupleField(Expression tuple, int index) {
            this.tuple = Objects.requireNonNull(tuple);
            this.index = index;
        }

        @Override
        public Type type() {
            Type tupleType = tuple.type();
            if (!(tupleType instanceof Type.Tuple)) {
                throw new IllegalStateException(String.format(
                        "Tried to extract field %d from non-tuple type %s", index, tupleType));
            }
            return ((Type.Tuple) tupleType).elements.get(index);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExtractTupleField(this);
        }

        @Override
        public String toString() {
            return tuple + "." + index;
        }
    }

    public static final class Call extends Expression {
        public final Expression func;
        public final List<Expression> arguments;
        public final Type returnType;

        public Call(Expression func, List<Expression> arguments, Type returnType) {
            this.func = Objects.requireNonNull(func);
            this.arguments = Collections.unmodifiableList(arguments);
            this.returnType = Objects.requireNonNull(returnType);
        }

        @Override
        public Type type() {
            return returnType;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder().append(func).append('(');
            for (int i = 0; i < arguments.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(arguments.get(i));
            }
            return sb.append(')').toString();
        }
    }

    public static final class Let extends Expression {
        public final int id;
        public final boolean mutable;
        public final String name;
        public final Expression expression;

        public Let(int id, boolean mutable, String name, Expression expression) {
            this.id = id;
            this.mutable = mutable;
            this.name = Objects.requireNonNull(name);
            this.expression = Objects.requireNonNull(expression);
        }

        @Override
        public Type type() {
            return Type.UNIT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLet(this);
        }

        @Override
        public String toString() {
            return "let " + (mutable ? "mut " : "") + name + " = " + expression;
        }
    }

    public static final class Constrain extends Expression {
        public final Expression expression;
        public final Location location;

        public Constrain(Expression expression, Location location) {
            this.expression = Objects.requireNonNull(expression);
            this.location = Objects.requireNonNull(location);
        }

        @Override
        public Type type() {
            return Type.UNIT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstrain(this);
        }

        @Override
        public String toString() {
            return "constrain " + expression;
        }
    }

    public static final class Assign extends Expression {
        public final LValue lvalue;
        public final Expression expression;

        public Assign(LValue lvalue, Expression expression) {
            this.lvalue = Objects.requireNonNull(lvalue);
            this.expression = Objects.requireNonNull(expression);
        }

        @Override
        public Type type() {
            return Type.UNIT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }

        @Override
        public String toString() {
            return lvalue + " = " + expression;
        }
    }

    /**
     * An expression evaluated only for its effects, discarding its value.
     */
    public static final class Semi extends Expression {
        public final Expression expression;

        public Semi(Expression expression) {
            this.expression = Objects.requireNonNull(expression);
        }

        @Override
        public Type type() {
            return Type.UNIT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSemi(this);
        }

        @Override
        public String toString() {
            return expression + ";";
        }
    }
}
