package io.github.monossa.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A fully concrete source type, as left by monomorphization.
 * <p>
 * Types are immutable, and compare by value.
 */
public abstract class Type {
    /**
     * The native field element type.
     */
    public static final Type FIELD = new Field();
    /**
     * The boolean type.
     */
    public static final Type BOOL = new Bool();
    /**
     * The unit type, the type of expressions evaluated only for their effects.
     */
    public static final Type UNIT = new Unit();

    private Type() {
    }

    public static Integer signed(int bitSize) {
        return new Integer(true, bitSize);
    }

    public static Integer unsigned(int bitSize) {
        return new Integer(false, bitSize);
    }

    public static Array array(long length, Type elementType) {
        return new Array(length, elementType);
    }

    public static Str str(long length) {
        return new Str(length);
    }

    public static Tuple tuple(Type... elements) {
        return new Tuple(Arrays.asList(elements));
    }

    public static Tuple tuple(List<Type> elements) {
        return new Tuple(elements);
    }

    public static Function function(List<Type> params, Type returnType) {
        return new Function(params, returnType);
    }

    /**
     * Check whether this is the unit type, or a tuple only containing units.
     *
     * @return Whether values of this type carry no data.
     */
    public boolean isUnit() {
        return false;
    }

    public static final class Field extends Type {
        private Field() {
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Field;
        }

        @Override
        public int hashCode() {
            return 1;
        }

        @Override
        public String toString() {
            return "Field";
        }
    }

    public static final class Bool extends Type {
        private Bool() {
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bool;
        }

        @Override
        public int hashCode() {
            return 2;
        }

        @Override
        public String toString() {
            return "bool";
        }
    }

    public static final class Unit extends Type {
        private Unit() {
        }

        @Override
        public boolean isUnit() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Unit;
        }

        @Override
        public int hashCode() {
            return 3;
        }

        @Override
        public String toString() {
            return "()";
        }
    }

    /**
     * A fixed width integer.
     */
    public static final class Integer extends Type {
        public final boolean signed;
        public final int bitSize;

        private Integer(boolean signed, int bitSize) {
            if (bitSize <= 0) {
                throw new IllegalArgumentException("Bad integer bit size: " + bitSize);
            }
            this.signed = signed;
            this.bitSize = bitSize;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Integer)) return false;
            Integer that = (Integer) o;
            return signed == that.signed && bitSize == that.bitSize;
        }

        @Override
        public int hashCode() {
            return Objects.hash(signed, bitSize);
        }

        @Override
        public String toString() {
            return (signed ? "i" : "u") + bitSize;
        }
    }

    public static final class Array extends Type {
        public final long length;
        public final Type elementType;

        private Array(long length, Type elementType) {
            this.length = length;
            this.elementType = Objects.requireNonNull(elementType);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Array)) return false;
            Array that = (Array) o;
            return length == that.length && elementType.equals(that.elementType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(length, elementType);
        }

        @Override
        public String toString() {
            return "[" + elementType + "; " + length + "]";
        }
    }

    /**
     * A string of {@code length} bytes.
     */
    public static final class Str extends Type {
        public final long length;

        private Str(long length) {
            this.length = length;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Str && ((Str) o).length == length;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(length) * 31 + 4;
        }

        @Override
        public String toString() {
            return "str<" + length + ">";
        }
    }

    public static final class Tuple extends Type {
        public final List<Type> elements;

        private Tuple(List<Type> elements) {
            this.elements = Collections.unmodifiableList(elements);
        }

        @Override
        public boolean isUnit() {
            for (Type element : elements) {
                if (!element.isUnit()) return false;
            }
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Tuple && ((Tuple) o).elements.equals(elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public String toString() {
            return elements.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "(", ")"));
        }
    }

    public static final class Function extends Type {
        public final List<Type> params;
        public final Type returnType;

        private Function(List<Type> params, Type returnType) {
            this.params = Collections.unmodifiableList(params);
            this.returnType = Objects.requireNonNull(returnType);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Function)) return false;
            Function that = (Function) o;
            return params.equals(that.params) && returnType.equals(that.returnType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(params, returnType);
        }

        @Override
        public String toString() {
            return params.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "fn(", ") -> " + returnType));
        }
    }
}
