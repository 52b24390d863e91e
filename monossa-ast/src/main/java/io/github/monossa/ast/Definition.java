package io.github.monossa.ast;

/**
 * What an identifier refers to, as resolved by name resolution.
 */
public abstract class Definition {
    private Definition() {
    }

    public static Local local(int id) {
        return new Local(id);
    }

    public static Function function(int funcId) {
        return new Function(funcId);
    }

    /**
     * A local variable or parameter, unique within its function.
     */
    public static final class Local extends Definition {
        public final int id;

        private Local(int id) {
            this.id = id;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Local && ((Local) o).id == id;
        }

        @Override
        public int hashCode() {
            return id;
        }

        @Override
        public String toString() {
            return "local " + id;
        }
    }

    /**
     * A function of the {@link Program}.
     */
    public static final class Function extends Definition {
        public final int funcId;

        private Function(int funcId) {
            this.funcId = funcId;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Function && ((Function) o).funcId == funcId;
        }

        @Override
        public int hashCode() {
            return ~funcId;
        }

        @Override
        public String toString() {
            return "function " + funcId;
        }
    }
}
