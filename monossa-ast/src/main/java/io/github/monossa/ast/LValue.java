package io.github.monossa.ast;

import java.util.Objects;

/**
 * The target of an {@link Expression.Assign assignment}.
 */
public abstract class LValue {
    private LValue() {
    }

    /**
     * Get the static type of the place this refers to.
     *
     * @return The type.
     */
    public abstract Type type();

    /**
     * A variable.
     */
    public static final class Ident extends LValue {
        public final Expression.Ident ident;

        public Ident(Expression.Ident ident) {
            this.ident = Objects.requireNonNull(ident);
        }

        @Override
        public Type type() {
            return ident.type;
        }

        @Override
        public String toString() {
            return ident.toString();
        }
    }

    /**
     * An element of an array.
     */
    public static final class Index extends LValue {
        public final LValue array;
        public final Expression index;
        public final Type elementType;

        public Index(LValue array, Expression index, Type elementType) {
            this.array = Objects.requireNonNull(array);
            this.index = Objects.requireNonNull(index);
            this.elementType = Objects.requireNonNull(elementType);
        }

        @Override
        public Type type() {
            return elementType;
        }

        @Override
        public String toString() {
            return array + "[" + index + "]";
        }
    }

    /**
     * A field of a tuple.
     */
    public static final class MemberAccess extends LValue {
        public final LValue object;
        public final int fieldIndex;

        public MemberAccess(LValue object, int fieldIndex) {
            this.object = Objects.requireNonNull(object);
            this.fieldIndex = fieldIndex;
        }

        @Override
        public Type type() {
            Type objectType = object.type();
            if (!(objectType instanceof Type.Tuple)) {
                throw new IllegalStateException(String.format(
                        "Tried to access field %d of non-tuple type %s", fieldIndex, objectType));
            }
            return ((Type.Tuple) objectType).elements.get(fieldIndex);
        }

        @Override
        public String toString() {
            return object + "." + fieldIndex;
        }
    }
}
