package org.circomscan.structure.cfg;

import org.circomscan.structure.ast.AssignOperator;
import org.circomscan.structure.ir.IrExpression;
import org.circomscan.structure.ir.IrStatement;
import org.circomscan.structure.ir.VariableName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
CFG -> SSA, in place. Only local variables (and parameters) are renamed; signals and components keep their name.

1. phi statements are inserted at the iterated dominance frontier of the blocks defining a variable,
   where that variable is live;
2. variables are renamed walking the dominator tree, parameters start at version 0;
3. a phi missing an argument (no definition along some incoming edge) is only a problem when its value is read.
 */
public class SsaConverter {
    private static final Logger LOGGER = LoggerFactory.getLogger(SsaConverter.class);

    private final Cfg cfg;
    private final DominatorTree dominatorTree;
    private final Map<String, Deque<VariableName>> stacks = new HashMap<>();
    private final Map<String, Integer> counters = new HashMap<>();

    public SsaConverter(Cfg cfg) {
        this.cfg = cfg;
        this.dominatorTree = new DominatorTree(cfg);
    }

    public void convert() {
        if (cfg.isSsa()) {
            throw new IllegalStateException("CFG of " + cfg.name() + " is already in SSA form");
        }
        insertPhis();
        List<VariableName> versionedParameters = new ArrayList<>();
        for (VariableName parameter : cfg.parameters()) {
            versionedParameters.add(pushNewVersion(parameter.name()));
        }
        rename(cfg.entryBlock().index());
        checkPhiArguments();
        cfg.markSsa(versionedParameters);
        LOGGER.trace("Converted {} {} to SSA form", cfg.kind().keyword(), cfg.name());
    }

    private void insertPhis() {
        Liveness liveness = new Liveness(cfg);
        Map<String, Set<Integer>> definedIn = new LinkedHashMap<>();
        cfg.parameters().forEach(p -> definedIn.computeIfAbsent(p.name(), k -> new LinkedHashSet<>()).add(0));
        for (BasicBlock block : cfg) {
            for (IrStatement statement : block) {
                VariableName defined = statement.definesOrNull();
                if (defined != null && cfg.isLocal(defined)) {
                    definedIn.computeIfAbsent(defined.name(), k -> new LinkedHashSet<>()).add(block.index());
                }
            }
        }
        Map<Integer, List<String>> phis = new TreeMap<>();
        for (Map.Entry<String, Set<Integer>> entry : definedIn.entrySet()) {
            String variable = entry.getKey();
            Set<Integer> hasPhi = new HashSet<>();
            Deque<Integer> workList = new ArrayDeque<>(entry.getValue());
            while (!workList.isEmpty()) {
                int block = workList.pop();
                for (int frontier : dominatorTree.dominanceFrontier(block)) {
                    if (!hasPhi.contains(frontier) && liveness.isLiveIn(frontier, variable)) {
                        hasPhi.add(frontier);
                        phis.computeIfAbsent(frontier, k -> new ArrayList<>()).add(variable);
                        if (!entry.getValue().contains(frontier)) workList.push(frontier);
                    }
                }
            }
        }
        for (Map.Entry<Integer, List<String>> entry : phis.entrySet()) {
            BasicBlock block = cfg.block(entry.getKey());
            int arity = block.predecessors().size();
            List<IrStatement> phiStatements = entry.getValue().stream()
                    .map(v -> (IrStatement) new IrStatement.Substitution(cfg.meta(), VariableName.of(v), List.of(),
                            AssignOperator.ASSIGN_VARIABLE,
                            new IrExpression.Phi(cfg.meta(), Collections.nCopies(arity, VariableName.of(v)))))
                    .toList();
            block.addAll(0, phiStatements);
        }
    }

    private VariableName pushNewVersion(String name) {
        int version = counters.merge(name, 1, Integer::sum) - 1;
        VariableName versioned = new VariableName(name, version);
        stacks.computeIfAbsent(name, k -> new ArrayDeque<>()).push(versioned);
        return versioned;
    }

    private VariableName currentVersionOrNull(String name) {
        Deque<VariableName> stack = stacks.get(name);
        return stack == null || stack.isEmpty() ? null : stack.peek();
    }

    private void rename(int index) {
        BasicBlock block = cfg.block(index);
        List<String> pushed = new ArrayList<>();
        for (int i = 0; i < block.size(); ++i) {
            IrStatement statement = block.statements().get(i);
            if (!isPhi(statement)) {
                IrStatement original = statement;
                statement = statement.renameReads(read -> resolve(read, original));
            }
            VariableName defined = statement.definesOrNull();
            if (defined != null && cfg.isLocal(defined)) {
                statement = statement.withDefinition(pushNewVersion(defined.name()));
                pushed.add(defined.name());
            }
            block.set(i, statement);
        }
        for (int successor : block.successors()) {
            BasicBlock next = cfg.block(successor);
            int position = next.predecessors().indexOf(index);
            for (int i = 0; i < next.size() && isPhi(next.statements().get(i)); ++i) {
                IrStatement.Substitution phiStatement = (IrStatement.Substitution) next.statements().get(i);
                IrExpression.Phi phi = (IrExpression.Phi) phiStatement.rhs();
                VariableName current = currentVersionOrNull(phiStatement.variable().name());
                if (current != null) {
                    next.set(i, phiStatement.withRhs(phi.withArgument(position, current)));
                }
            }
        }
        for (int child : dominatorTree.children(index)) {
            rename(child);
        }
        for (String name : pushed) {
            stacks.get(name).pop();
        }
    }

    private VariableName resolve(VariableName read, IrStatement statement) {
        if (!cfg.isLocal(read)) return read;
        VariableName current = currentVersionOrNull(read.name());
        if (current == null) {
            throw new SsaException(new SsaError.UndefinedVariable(read.name(), statement.meta()));
        }
        return current;
    }

    private static boolean isPhi(IrStatement statement) {
        return statement instanceof IrStatement.Substitution s && s.isPhi();
    }

    /*
    a phi argument without version had no reaching definition; propagate through phis that use such a value,
    then fail on the first ordinary statement reading one of them
     */
    private void checkPhiArguments() {
        Set<VariableName> unassigned = new HashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (BasicBlock block : cfg) {
                for (IrStatement statement : block) {
                    if (isPhi(statement)) {
                        IrStatement.Substitution s = (IrStatement.Substitution) statement;
                        IrExpression.Phi phi = (IrExpression.Phi) s.rhs();
                        boolean incomplete = phi.arguments().stream()
                                .anyMatch(a -> !a.hasVersion() || unassigned.contains(a));
                        if (incomplete && unassigned.add(s.variable())) changed = true;
                    }
                }
            }
        }
        if (unassigned.isEmpty()) return;
        for (BasicBlock block : cfg) {
            for (IrStatement statement : block) {
                if (isPhi(statement)) continue;
                List<VariableName> reads = new ArrayList<>();
                statement.collectReads(reads);
                for (VariableName read : reads) {
                    if (unassigned.contains(read)) {
                        throw new SsaException(new SsaError.UndefinedVariable(read.name(), statement.meta()));
                    }
                }
            }
        }
    }
}
