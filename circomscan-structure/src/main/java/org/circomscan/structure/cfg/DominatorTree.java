package org.circomscan.structure.cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/*
Immediate dominators, dominator tree and dominance frontiers of a CFG whose blocks are all reachable.

Cooper, Keith D.; Harvey, Timothy J.; Kennedy, Ken (2001). "A Simple, Fast Dominance Algorithm"
 */
public class DominatorTree {
    private final int[] idom;
    private final int[] postOrderNumber;
    private final List<List<Integer>> children;
    private final List<Set<Integer>> frontiers;

    public DominatorTree(Cfg cfg) {
        int n = cfg.size();
        idom = new int[n];
        postOrderNumber = new int[n];
        List<Integer> reversePostOrder = reversePostOrder(cfg);
        computeDominators(cfg, reversePostOrder);

        children = new ArrayList<>(n);
        frontiers = new ArrayList<>(n);
        for (int i = 0; i < n; ++i) {
            children.add(new ArrayList<>());
            frontiers.add(new LinkedHashSet<>());
        }
        for (int b = 1; b < n; ++b) {
            children.get(idom[b]).add(b);
        }
        computeFrontiers(cfg);
    }

    private List<Integer> reversePostOrder(Cfg cfg) {
        int n = cfg.size();
        boolean[] visited = new boolean[n];
        List<Integer> postOrder = new ArrayList<>(n);
        // iterative DFS; the int[] holds (block, next successor position)
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{0, 0});
        visited[0] = true;
        while (!stack.isEmpty()) {
            int[] top = stack.peek();
            List<Integer> successors = cfg.block(top[0]).successors();
            if (top[1] < successors.size()) {
                int next = successors.get(top[1]++);
                if (!visited[next]) {
                    visited[next] = true;
                    stack.push(new int[]{next, 0});
                }
            } else {
                postOrderNumber[top[0]] = postOrder.size();
                postOrder.add(top[0]);
                stack.pop();
            }
        }
        if (postOrder.size() != n) {
            throw new IllegalStateException("CFG of " + cfg.name() + " has unreachable blocks");
        }
        Collections.reverse(postOrder);
        return postOrder;
    }

    private void computeDominators(Cfg cfg, List<Integer> reversePostOrder) {
        Arrays.fill(idom, -1);
        idom[0] = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int b : reversePostOrder) {
                if (b == 0) continue;
                int newIdom = -1;
                for (int p : cfg.block(b).predecessors()) {
                    if (idom[p] != -1) {
                        newIdom = newIdom == -1 ? p : intersect(p, newIdom);
                    }
                }
                if (idom[b] != newIdom) {
                    idom[b] = newIdom;
                    changed = true;
                }
            }
        }
    }

    private int intersect(int b1, int b2) {
        int finger1 = b1;
        int finger2 = b2;
        while (finger1 != finger2) {
            while (postOrderNumber[finger1] < postOrderNumber[finger2]) finger1 = idom[finger1];
            while (postOrderNumber[finger2] < postOrderNumber[finger1]) finger2 = idom[finger2];
        }
        return finger1;
    }

    private void computeFrontiers(Cfg cfg) {
        for (BasicBlock block : cfg) {
            List<Integer> predecessors = block.predecessors();
            if (predecessors.size() >= 2) {
                for (int p : predecessors) {
                    int runner = p;
                    while (runner != idom[block.index()]) {
                        frontiers.get(runner).add(block.index());
                        runner = idom[runner];
                    }
                }
            }
        }
    }

    public List<Integer> children(int block) {
        return Collections.unmodifiableList(children.get(block));
    }

    public Set<Integer> dominanceFrontier(int block) {
        return Collections.unmodifiableSet(frontiers.get(block));
    }
}
