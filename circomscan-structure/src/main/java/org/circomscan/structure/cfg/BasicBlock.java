package org.circomscan.structure.cfg;

import org.circomscan.structure.ir.IrStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/*
A sequence of IR statements without internal control flow. The last statement may be a control statement;
for an IfThenElse, successor 0 is the true branch and successor 1 the false branch.

Analysis passes only get read-only views; the builders in this package modify blocks in place.
 */
public class BasicBlock implements Iterable<IrStatement> {
    private int index;
    private final List<IrStatement> statements = new ArrayList<>();
    private final List<Integer> predecessors = new ArrayList<>();
    private final List<Integer> successors = new ArrayList<>();

    BasicBlock(int index) {
        this.index = index;
    }

    public int index() {
        return index;
    }

    public List<IrStatement> statements() {
        return Collections.unmodifiableList(statements);
    }

    public List<Integer> predecessors() {
        return Collections.unmodifiableList(predecessors);
    }

    public List<Integer> successors() {
        return Collections.unmodifiableList(successors);
    }

    public int size() {
        return statements.size();
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public boolean isTerminated() {
        return !statements.isEmpty() && statements.get(statements.size() - 1) instanceof IrStatement.Return;
    }

    @Override
    public Iterator<IrStatement> iterator() {
        return statements().iterator();
    }

    void add(IrStatement statement) {
        statements.add(statement);
    }

    void set(int position, IrStatement statement) {
        statements.set(position, statement);
    }

    void addAll(int position, List<? extends IrStatement> newStatements) {
        statements.addAll(position, newStatements);
    }

    void addSuccessor(int successor) {
        successors.add(successor);
    }

    void addPredecessor(int predecessor) {
        predecessors.add(predecessor);
    }

    /*
    after pruning unreachable blocks: renumber this block and its edges; edges to blocks that are not in the map
    are dropped
     */
    void renumber(Map<Integer, Integer> oldToNew) {
        index = oldToNew.get(index);
        remap(predecessors, oldToNew);
        remap(successors, oldToNew);
    }

    private static void remap(List<Integer> edges, Map<Integer, Integer> oldToNew) {
        List<Integer> remapped = edges.stream().filter(oldToNew::containsKey).map(oldToNew::get).toList();
        edges.clear();
        edges.addAll(remapped);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("bb").append(index).append(" preds ").append(predecessors).append(" succs ").append(successors);
        statements.forEach(s -> sb.append("\n    ").append(s));
        return sb.toString();
    }
}
