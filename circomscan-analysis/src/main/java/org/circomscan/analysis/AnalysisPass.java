package org.circomscan.analysis;

import org.circomscan.structure.cfg.Cfg;
import org.circomscan.structure.report.ReportCollection;

/*
A read-only analysis of one CFG. Passes may look up other templates and functions through the context,
which can cause them to be lowered (and, for recursive definitions, the one being analyzed to be lowered again).
 */
@FunctionalInterface
public interface AnalysisPass {

    ReportCollection run(AnalysisContext context, Cfg cfg);
}
