/**
 * The monomorphized input program consumed by SSA generation.
 * <p>
 * A {@link io.github.monossa.ast.Program} is a table of
 * {@link io.github.monossa.ast.FunctionDef}s, each with exactly one concrete body.
 * Generics and overloads have been resolved, every {@link io.github.monossa.ast.Type}
 * is concrete, and every identifier carries its resolved
 * {@link io.github.monossa.ast.Definition}. Nothing in this package is validated
 * beyond basic structural checks; the producer is trusted.
 */
package io.github.monossa.ast;
