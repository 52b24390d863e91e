package io.github.monossa.ssa;

import io.github.monossa.ext.CommonExts;
import io.github.monossa.ext.ExtHolder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A function of the SSA IR: a list of basic blocks, the first of which is the entry.
 * <p>
 * The parameters of the entry block are the parameters of the function.
 */
public final class Function extends ExtHolder {
    public final FunctionId id;
    public final String name;
    private final List<BasicBlock> blocks = new ArrayList<>(); // [0] is entry
    private final List<ScalarType> returnTypes;
    private int varCount = 0;

    public Function(FunctionId id, String name, List<ScalarType> returnTypes) {
        this.id = Objects.requireNonNull(id);
        this.name = Objects.requireNonNull(name);
        this.returnTypes = Collections.unmodifiableList(new ArrayList<>(returnTypes));
        newBb();
    }

    /**
     * Create a var which is unique within this function.
     *
     * @param name The name of the var, for display.
     * @param type The type of the var.
     * @return The var.
     */
    public Var newVar(String name, ScalarType type) {
        return new Var(name, varCount++, type);
    }

    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock(blocks.size());
        bb.attachExt(CommonExts.OWNING_FUNCTION, this);
        blocks.add(bb);
        return bb;
    }

    public BasicBlock getEntry() {
        return blocks.get(0);
    }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public List<Var> getParams() {
        return getEntry().getParams();
    }

    public List<ScalarType> getReturnTypes() {
        return returnTypes;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name).append('#').append(id)
                .append(returnTypes.stream()
                        .map(Objects::toString)
                        .collect(Collectors.joining(", ", " -> (", ")")))
                .append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }
}
