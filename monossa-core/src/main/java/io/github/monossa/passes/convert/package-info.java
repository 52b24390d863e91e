/**
 * Passes that convert into the SSA IR from another form.
 * <p>
 * {@link io.github.monossa.passes.convert.AstToSsa} is the entry point; the other classes
 * hold the state of a single conversion.
 */
package io.github.monossa.passes.convert;
