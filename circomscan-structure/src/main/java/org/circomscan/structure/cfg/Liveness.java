package org.circomscan.structure.cfg;

import org.circomscan.structure.ir.IrStatement;
import org.circomscan.structure.ir.VariableName;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/*
Live local variables at the start of each block, computed on the CFG before SSA conversion
(variable names without version). Only local variables are tracked.
 */
public class Liveness {
    private final List<Set<String>> liveIn;

    public Liveness(Cfg cfg) {
        int n = cfg.size();
        List<Set<String>> uses = new ArrayList<>(n);
        List<Set<String>> defs = new ArrayList<>(n);
        for (BasicBlock block : cfg) {
            Set<String> use = new HashSet<>();
            Set<String> def = new HashSet<>();
            for (IrStatement statement : block) {
                List<VariableName> reads = new ArrayList<>();
                statement.collectReads(reads);
                for (VariableName read : reads) {
                    if (cfg.isLocal(read) && !def.contains(read.name())) use.add(read.name());
                }
                VariableName defined = statement.definesOrNull();
                if (defined != null && cfg.isLocal(defined)) def.add(defined.name());
            }
            uses.add(use);
            defs.add(def);
        }
        liveIn = new ArrayList<>(n);
        for (int i = 0; i < n; ++i) liveIn.add(new HashSet<>(uses.get(i)));

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int b = n - 1; b >= 0; --b) {
                Set<String> liveOut = new HashSet<>();
                for (int s : cfg.block(b).successors()) liveOut.addAll(liveIn.get(s));
                liveOut.removeAll(defs.get(b));
                if (liveIn.get(b).addAll(liveOut)) changed = true;
            }
        }
    }

    public boolean isLiveIn(int block, String variable) {
        return liveIn.get(block).contains(variable);
    }
}
