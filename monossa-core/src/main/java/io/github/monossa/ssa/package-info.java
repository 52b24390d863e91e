/**
 * The static single assignment IR produced by SSA generation.
 * <p>
 * An {@link io.github.monossa.ssa.SsaProgram} holds {@link io.github.monossa.ssa.Function}s,
 * made of {@link io.github.monossa.ssa.BasicBlock}s. A block has typed parameters,
 * a list of {@link io.github.monossa.ssa.Effect}s and exactly one
 * {@link io.github.monossa.ssa.Control}. Each {@link io.github.monossa.ssa.Var} is
 * defined exactly once, either by an effect or as a block parameter.
 * <p>
 * There are no phi instructions. Values meeting at a control flow merge are passed
 * as jump arguments to the parameters of the merge block.
 * <p>
 * IR is built through an {@link io.github.monossa.ssa.IRBuilder}, which tracks
 * the block instructions are being appended to.
 */
package io.github.monossa.ssa;
