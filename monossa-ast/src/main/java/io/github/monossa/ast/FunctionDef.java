package io.github.monossa.ast;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single monomorphized function: one concrete body, no generics.
 */
public final class FunctionDef {
    public final int id;
    public final String name;
    public final List<Parameter> parameters;
    public final Expression body;
    public final Type returnType;

    public FunctionDef(int id, String name, List<Parameter> parameters, Expression body, Type returnType) {
        this.id = id;
        this.name = Objects.requireNonNull(name);
        this.parameters = Collections.unmodifiableList(parameters);
        this.body = Objects.requireNonNull(body);
        this.returnType = Objects.requireNonNull(returnType);
    }

    @Override
    public String toString() {
        return "fn " + name + "#" + id + parameters + " -> " + returnType;
    }
}
