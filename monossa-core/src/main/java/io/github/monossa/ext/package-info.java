/**
 * Exts associate arbitrary data with IR objects.
 *
 * <pre>{@code
 * public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");
 *
 * block.attachExt(PREDS, new ArrayList<>());
 * block.getExtOrThrow(PREDS).add(pred);
 * }</pre>
 * <p>
 * Passes use them for data derived from the IR, so it can be computed on demand
 * and thrown away, without changing the IR classes.
 */
package io.github.monossa.ext;
