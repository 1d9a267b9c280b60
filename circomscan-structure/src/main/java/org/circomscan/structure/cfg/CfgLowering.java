package org.circomscan.structure.cfg;

import org.circomscan.structure.constants.Curve;
import org.circomscan.structure.definition.Definition;
import org.circomscan.structure.report.ReportCollection;

/*
Definition -> CFG in SSA form.
Non-fatal diagnostics are added to 'reports'; a fatal one is thrown as a LoweringException.
 */
@FunctionalInterface
public interface CfgLowering {

    Cfg lower(Definition definition, Curve curve, ReportCollection reports);
}
