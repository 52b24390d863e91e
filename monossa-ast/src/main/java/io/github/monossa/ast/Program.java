package io.github.monossa.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A whole monomorphized program: a table of functions, one of which is the entry point.
 */
public final class Program {
    private final Map<Integer, FunctionDef> functions = new LinkedHashMap<>();
    public final int mainId;

    public Program(List<FunctionDef> functions, int mainId) {
        for (FunctionDef function : functions) {
            if (this.functions.put(function.id, function) != null) {
                throw new IllegalArgumentException("Duplicate function id " + function.id);
            }
        }
        if (!this.functions.containsKey(mainId)) {
            throw new IllegalArgumentException("No entry function with id " + mainId);
        }
        this.mainId = mainId;
    }

    @NotNull
    public FunctionDef main() {
        return get(mainId);
    }

    /**
     * Get the function with the given id.
     *
     * @param id The id of the function.
     * @return The function.
     * @throws IllegalStateException If there is no such function.
     */
    @NotNull
    public FunctionDef get(int id) {
        FunctionDef function = functions.get(id);
        if (function == null) {
            throw new IllegalStateException("Reference to unknown function " + id);
        }
        return function;
    }

    public Iterable<FunctionDef> functions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    public int size() {
        return functions.size();
    }
}
