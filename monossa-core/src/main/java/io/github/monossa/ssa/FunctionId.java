package io.github.monossa.ssa;

/**
 * The identity of a generated {@link Function}, which may be reserved before the function is built.
 */
public final class FunctionId implements Comparable<FunctionId> {
    public final int id;

    public FunctionId(int id) {
        this.id = id;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FunctionId && ((FunctionId) o).id == id;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public int compareTo(FunctionId o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public String toString() {
        return "f" + id;
    }
}
