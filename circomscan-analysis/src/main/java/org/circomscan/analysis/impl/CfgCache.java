package org.circomscan.analysis.impl;

import org.circomscan.analysis.AnalysisException;
import org.circomscan.analysis.Checkout;
import org.circomscan.structure.cfg.Cfg;
import org.circomscan.structure.cfg.CfgLowering;
import org.circomscan.structure.cfg.LoweringException;
import org.circomscan.structure.constants.Curve;
import org.circomscan.structure.definition.Definition;
import org.circomscan.structure.definition.DefinitionKind;
import org.circomscan.structure.report.ReportCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/*
Lazily lowered CFGs of one kind of definition, keyed by name, with the reports produced while lowering them.

A name is in at most one of three states: cached, checked out (take() without matching replace()), or failed.
Failure is remembered, so that the lowering is attempted once; its report is produced once as well.
Once the reports of a name have been taken, reports coming from a renewed lowering of that name are dropped:
they would be identical to the ones already handed out.
 */
public class CfgCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(CfgCache.class);

    private final DefinitionKind kind;
    private final Function<String, Definition> definitions;
    private final CfgLowering lowering;
    private final Curve curve;

    private final Map<String, Cfg> cfgs = new HashMap<>();
    private final Map<String, ReportCollection> reports = new HashMap<>();
    private final Set<String> failed = new HashSet<>();
    private final Set<String> exhausted = new HashSet<>();
    private final Map<String, Integer> loweringCounts = new HashMap<>();

    public CfgCache(DefinitionKind kind, Function<String, Definition> definitions, CfgLowering lowering,
                    Curve curve) {
        this.kind = Objects.requireNonNull(kind);
        this.definitions = Objects.requireNonNull(definitions);
        this.lowering = Objects.requireNonNull(lowering);
        this.curve = Objects.requireNonNull(curve);
    }

    public DefinitionKind kind() {
        return kind;
    }

    /*
    returns the cached CFG, lowering the definition when needed.
    The CFG stays in the cache; callers must not hold on to it.
     */
    public Cfg ensure(String name) {
        Cfg cfg = cfgs.get(name);
        if (cfg != null) {
            LOGGER.trace("Cache hit for {} {}", kind.keyword(), name);
            return cfg;
        }
        if (failed.contains(name)) {
            throw AnalysisException.failedToLift(kind, name, null);
        }
        Definition definition = definitions.apply(name);
        if (definition == null) {
            throw AnalysisException.unknown(kind, name);
        }
        loweringCounts.merge(name, 1, Integer::sum);
        ReportCollection loweringReports = new ReportCollection();
        try {
            cfg = lowering.lower(definition, curve, loweringReports);
        } catch (LoweringException le) {
            LOGGER.debug("Failed to lift {} {}: {}", kind.keyword(), name, le.getMessage());
            failed.add(name);
            storeLoweringReports(name, loweringReports);
            // the failure itself is reported exactly once, as the name is never lowered again
            appendReports(name, ReportCollection.of(le.toReport()));
            throw AnalysisException.failedToLift(kind, name, le);
        }
        storeLoweringReports(name, loweringReports);
        cfgs.put(name, cfg);
        LOGGER.trace("Lifted {} {}", kind.keyword(), name);
        return cfg;
    }

    private void storeLoweringReports(String name, ReportCollection loweringReports) {
        if (exhausted.contains(name)) {
            if (!loweringReports.isEmpty()) {
                LOGGER.trace("Dropping {} reports of regenerated {} {}", loweringReports.size(), kind.keyword(),
                        name);
            }
            return;
        }
        appendReports(name, loweringReports);
    }

    /*
    removes the CFG from the cache, together with the pending reports of the name.
    The caller is responsible for returning the CFG with replace().
     */
    public Checkout take(String name) {
        ensure(name);
        Cfg cfg = cfgs.remove(name);
        return new Checkout(cfg, takeReports(name));
    }

    /*
    last write wins; returns true when an entry was overwritten
     */
    public boolean replace(String name, Cfg cfg) {
        Objects.requireNonNull(cfg);
        return cfgs.put(name, cfg) != null;
    }

    public ReportCollection takeReports(String name) {
        ReportCollection taken = reports.remove(name);
        if (loweringCounts.containsKey(name)) {
            exhausted.add(name);
        }
        return taken == null ? new ReportCollection() : taken;
    }

    public void appendReports(String name, ReportCollection more) {
        if (more.isEmpty()) return;
        reports.computeIfAbsent(name, k -> new ReportCollection()).append(more);
    }

    public boolean isCached(String name) {
        return cfgs.containsKey(name);
    }

    public boolean hasFailed(String name) {
        return failed.contains(name);
    }

    public boolean hasPendingReports(String name) {
        ReportCollection pending = reports.get(name);
        return pending != null && !pending.isEmpty();
    }

    public int loweringCount(String name) {
        return loweringCounts.getOrDefault(name, 0);
    }
}
