package io.github.monossa.util;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A tree with values at its leaves; either a single {@link Leaf} or an ordered {@link Branch} of subtrees.
 * <p>
 * Trees represent both composite types (a tuple is a branch of its element types)
 * and the values of those types, which always mirror the shape of their type.
 * The empty branch is the unit value, and the unit type.
 * <p>
 * Leaves are always enumerated depth-first, left to right. This order is the order
 * composites are passed as arguments, stored to memory and merged at block parameters.
 *
 * @param <T> The type of the leaves.
 */
public abstract class Tree<T> implements Iterable<T> {
    private static final Tree<?> EMPTY = new Branch<>(Collections.emptyList());

    private Tree() {
    }

    public static <T> Tree<T> leaf(T value) {
        return new Leaf<>(value);
    }

    public static <T> Tree<T> branch(List<Tree<T>> children) {
        return children.isEmpty() ? empty() : new Branch<>(new ArrayList<>(children));
    }

    @SafeVarargs
    public static <T> Tree<T> branch(Tree<T>... children) {
        return branch(Arrays.asList(children));
    }

    /**
     * Get the empty branch, which is used as the unit value.
     *
     * @param <T> The type of the leaves.
     * @return The empty tree.
     */
    @SuppressWarnings("unchecked")
    public static <T> Tree<T> empty() {
        return (Tree<T>) EMPTY;
    }

    public abstract boolean isLeaf();

    /**
     * Get the value of this tree, if it is a leaf.
     *
     * @return The value.
     * @throws IllegalStateException If this is a branch.
     */
    public T getLeaf() {
        throw new IllegalStateException("Expected a single value, found composite " + this);
    }

    /**
     * Get the subtrees of this tree, if it is a branch.
     *
     * @return The subtrees, unmodifiable.
     * @throws IllegalStateException If this is a leaf.
     */
    public List<Tree<T>> getChildren() {
        throw new IllegalStateException("Expected a composite, found single value " + this);
    }

    /**
     * Get the {@code index}th subtree of this branch.
     *
     * @param index The index.
     * @return The subtree.
     * @throws IllegalStateException If this is a leaf.
     */
    public Tree<T> get(int index) {
        List<Tree<T>> children = getChildren();
        if (index < 0 || index >= children.size()) {
            throw new IllegalStateException(String.format(
                    "Tried to extract index %d from composite of %d elements %s",
                    index, children.size(), this));
        }
        return children.get(index);
    }

    /**
     * Map every leaf of this tree, keeping its shape.
     *
     * @param f   The function to apply to each leaf, called in leaf order.
     * @param <U> The new type of the leaves.
     * @return The mapped tree.
     */
    public abstract <U> Tree<U> map(F<? super T, ? extends U> f);

    /**
     * Visit every leaf of this tree, depth-first.
     *
     * @param action The visitor.
     */
    @Override
    public abstract void forEach(Consumer<? super T> action);

    /**
     * Count the leaves of this tree.
     * <p>
     * For a type tree this is the number of storage slots a value of the type occupies,
     * since every leaf takes exactly one slot, whatever its width.
     *
     * @return The number of leaves.
     */
    public abstract int sizeOfType();

    /**
     * Collect the leaves of this tree in order.
     *
     * @return A new list of the leaves.
     */
    public List<T> flatten() {
        List<T> list = new ArrayList<>();
        forEach(list::add);
        return list;
    }

    @NotNull
    @Override
    public Iterator<T> iterator() {
        return flatten().iterator();
    }

    /**
     * Build a tree with the same shape as this one, taking the leaves from a flat list.
     *
     * @param leaves The leaves, in order. Must have exactly as many elements as this has leaves.
     * @param <U>    The type of the leaves.
     * @return The new tree.
     * @throws IllegalStateException If the number of leaves doesn't match.
     */
    public <U> Tree<U> reshape(List<U> leaves) {
        if (leaves.size() != sizeOfType()) {
            throw new IllegalStateException(String.format(
                    "Cannot shape %d values as %s, which has %d leaves",
                    leaves.size(), this, sizeOfType()));
        }
        Iterator<U> it = leaves.iterator();
        return map($ -> it.next());
    }

    /**
     * Replace the subtree found by following a path of child indices.
     * <p>
     * This tree is left unchanged; the branches along the path are copied.
     *
     * @param path        The indices to follow, outermost first.
     * @param replacement The new subtree.
     * @return The new tree.
     */
    public Tree<T> replace(List<Integer> path, Tree<T> replacement) {
        if (path.isEmpty()) {
            return replacement;
        }
        int index = path.get(0);
        List<Tree<T>> children = new ArrayList<>(getChildren());
        children.set(index, get(index).replace(path.subList(1, path.size()), replacement));
        return branch(children);
    }

    public static final class Leaf<T> extends Tree<T> {
        public final T value;

        private Leaf(T value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public boolean isLeaf() {
            return true;
        }

        @Override
        public T getLeaf() {
            return value;
        }

        @Override
        public <U> Tree<U> map(F<? super T, ? extends U> f) {
            return leaf(f.apply(value));
        }

        @Override
        public void forEach(Consumer<? super T> action) {
            action.accept(value);
        }

        @Override
        public int sizeOfType() {
            return 1;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Leaf && ((Leaf<?>) o).value.equals(value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    public static final class Branch<T> extends Tree<T> {
        private final List<Tree<T>> children;

        private Branch(List<Tree<T>> children) {
            this.children = Collections.unmodifiableList(children);
        }

        @Override
        public boolean isLeaf() {
            return false;
        }

        @Override
        public List<Tree<T>> getChildren() {
            return children;
        }

        @Override
        public <U> Tree<U> map(F<? super T, ? extends U> f) {
            List<Tree<U>> mapped = new ArrayList<>(children.size());
            for (Tree<T> child : children) {
                mapped.add(child.map(f));
            }
            return branch(mapped);
        }

        @Override
        public void forEach(Consumer<? super T> action) {
            for (Tree<T> child : children) {
                child.forEach(action);
            }
        }

        @Override
        public int sizeOfType() {
            int size = 0;
            for (Tree<T> child : children) {
                size += child.sizeOfType();
            }
            return size;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Branch && ((Branch<?>) o).children.equals(children);
        }

        @Override
        public int hashCode() {
            return children.hashCode() + 1;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(children.get(i));
            }
            return sb.append(')').toString();
        }
    }
}
