package io.github.monossa.passes.meta;

import io.github.monossa.ext.CommonExts;
import io.github.monossa.passes.InPlaceIRPass;
import io.github.monossa.ssa.BasicBlock;
import io.github.monossa.ssa.Control;
import io.github.monossa.ssa.Function;

import java.util.ArrayList;

/**
 * Computes {@link CommonExts#PREDS} for each block.
 * <p>
 * A block jumping to the same target twice is listed twice.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        for (BasicBlock block : func.getBlocks()) {
            block.attachExt(CommonExts.PREDS, new ArrayList<>());
        }
        for (BasicBlock block : func.getBlocks()) {
            Control control = block.getControl();
            if (control == null) continue;
            for (BasicBlock target : control.targets) {
                target.getExtOrThrow(CommonExts.PREDS).add(block);
            }
        }
    }
}
