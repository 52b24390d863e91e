package io.github.monossa.passes.meta;

import io.github.monossa.ext.CommonExts;
import io.github.monossa.passes.InPlaceIRPass;
import io.github.monossa.ssa.BasicBlock;
import io.github.monossa.ssa.Control;
import io.github.monossa.ssa.Function;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/*
 Keith D. Cooper, Timothy J. Harvey and Ken Kennedy. A Simple, Fast Dominance Algorithm.
 Software Practice and Experience, 4:1-10, 2001.
*/

/**
 * Computes {@link CommonExts#IDOM} for each block reachable from the entry.
 * <p>
 * Unreachable blocks are left without a dominator. Uses {@link CommonExts#PREDS},
 * running {@link ComputePreds} if they are missing.
 */
public class ComputeDoms implements InPlaceIRPass<Function> {
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(Function func) {
        func.getEntry().getExtOrRun(CommonExts.PREDS, func, ComputePreds.INSTANCE);

        List<BasicBlock> order = reversePostOrder(func);
        Map<BasicBlock, Integer> index = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            index.put(order.get(i), i);
        }

        int[] doms = new int[order.size()];
        Arrays.fill(doms, -1);
        doms[0] = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int b = 1; b < order.size(); b++) {
                int newIdom = -1;
                for (BasicBlock pred : order.get(b).getExtOrThrow(CommonExts.PREDS)) {
                    Integer p = index.get(pred);
                    if (p == null || doms[p] == -1) continue;
                    newIdom = newIdom == -1 ? p : intersect(doms, p, newIdom);
                }
                if (doms[b] != newIdom) {
                    doms[b] = newIdom;
                    changed = true;
                }
            }
        }

        for (BasicBlock block : func.getBlocks()) {
            block.removeExt(CommonExts.IDOM);
        }
        for (int b = 1; b < order.size(); b++) {
            order.get(b).attachExt(CommonExts.IDOM, order.get(doms[b]));
        }
    }

    private static int intersect(int[] doms, int a, int b) {
        while (a != b) {
            while (a > b) a = doms[a];
            while (b > a) b = doms[b];
        }
        return a;
    }

    private static List<BasicBlock> reversePostOrder(Function func) {
        List<BasicBlock> postOrder = new ArrayList<>();
        Set<BasicBlock> seen = new HashSet<>();
        Deque<Iterator<BasicBlock>> stack = new ArrayDeque<>();
        Deque<BasicBlock> path = new ArrayDeque<>();
        seen.add(func.getEntry());
        path.push(func.getEntry());
        stack.push(successors(func.getEntry()).iterator());
        while (!stack.isEmpty()) {
            Iterator<BasicBlock> it = stack.peek();
            if (it.hasNext()) {
                BasicBlock next = it.next();
                if (seen.add(next)) {
                    path.push(next);
                    stack.push(successors(next).iterator());
                }
            } else {
                stack.pop();
                postOrder.add(path.pop());
            }
        }
        Collections.reverse(postOrder);
        return postOrder;
    }

    private static List<BasicBlock> successors(BasicBlock block) {
        Control control = block.getControl();
        return control == null ? Collections.emptyList() : control.targets;
    }

    /**
     * Check whether a block dominates another, using the computed {@link CommonExts#IDOM}s.
     *
     * @param dominator The possible dominator.
     * @param block     The block.
     * @return Whether every path from the entry to {@code block} passes through {@code dominator}.
     */
    public static boolean dominates(BasicBlock dominator, BasicBlock block) {
        BasicBlock current = block;
        while (current != null) {
            if (current == dominator) return true;
            current = current.getNullable(CommonExts.IDOM);
        }
        return false;
    }
}
