package io.github.monossa.ssa;

import io.github.monossa.ext.ExtHolder;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The functions generated for a whole program, in the order they were finished.
 */
public final class SsaProgram extends ExtHolder {
    private final Map<FunctionId, Function> functions = new LinkedHashMap<>();
    private final FunctionId mainId;

    public SsaProgram(FunctionId mainId) {
        this.mainId = mainId;
    }

    public void add(Function function) {
        if (functions.putIfAbsent(function.id, function) != null) {
            throw new IllegalStateException("Function " + function.id + " was generated twice");
        }
    }

    @NotNull
    public Function get(FunctionId id) {
        Function function = functions.get(id);
        if (function == null) {
            throw new IllegalStateException("No function " + id);
        }
        return function;
    }

    public boolean contains(FunctionId id) {
        return functions.containsKey(id);
    }

    public FunctionId getMainId() {
        return mainId;
    }

    @NotNull
    public Function main() {
        return get(mainId);
    }

    public Collection<Function> functions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    public int size() {
        return functions.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Function function : functions.values()) {
            sb.append(function).append("\n\n");
        }
        return sb.toString();
    }
}
