package io.github.monossa.passes.misc;

import io.github.monossa.passes.IRPass;
import io.github.monossa.passes.InPlaceIRPass;
import io.github.monossa.ssa.Function;
import io.github.monossa.ssa.SsaProgram;

/**
 * Lifts passes which operate on smaller IR parts into ones that operate on bigger parts.
 */
public class ForPass {
    /**
     * Lift an in-place function pass to run on every function of a program.
     *
     * @param pass The function pass; must be in-place.
     * @return The program pass.
     */
    public static InPlaceIRPass<SsaProgram> liftFunctions(IRPass<Function, Function> pass) {
        if (!pass.isInPlace()) {
            throw new IllegalArgumentException("Only in-place passes can be lifted, got " + pass);
        }
        return program -> {
            for (Function function : program.functions()) {
                try {
                    pass.run(function);
                } catch (RuntimeException e) {
                    e.addSuppressed(new RuntimeException("in function " + function.name + "#" + function.id));
                    throw e;
                }
            }
        };
    }
}
