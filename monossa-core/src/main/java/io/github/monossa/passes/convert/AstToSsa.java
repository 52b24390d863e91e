package io.github.monossa.passes.convert;

import io.github.monossa.ast.Program;
import io.github.monossa.conf.SsaGenOptions;
import io.github.monossa.passes.IRPass;
import io.github.monossa.passes.meta.VerifyIntegrity;
import io.github.monossa.passes.misc.ForPass;
import io.github.monossa.ssa.SsaProgram;

/**
 * Converts a monomorphized program into SSA IR.
 * <p>
 * Only main and the functions reachable from it are generated. The output's main
 * always has id {@code f0}; other functions are numbered in the order they are first referenced.
 */
public class AstToSsa implements IRPass<Program, SsaProgram> {
    /**
     * An instance of this pass, with options from the environment.
     */
    public static final AstToSsa INSTANCE = new AstToSsa(SsaGenOptions.DEFAULT);

    private final IRPass<Program, SsaProgram> pipeline;

    public AstToSsa(SsaGenOptions options) {
        IRPass<Program, SsaProgram> generate = program -> new ProgramDriver(program, options).generate();
        pipeline = options.verify
                ? generate.then(ForPass.liftFunctions(VerifyIntegrity.INSTANCE))
                : generate;
    }

    @Override
    public SsaProgram run(Program program) {
        return pipeline.run(program);
    }
}
