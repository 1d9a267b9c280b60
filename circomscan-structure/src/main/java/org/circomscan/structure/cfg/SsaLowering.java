package org.circomscan.structure.cfg;

import org.circomscan.structure.constants.Curve;
import org.circomscan.structure.definition.Definition;
import org.circomscan.structure.report.ReportCollection;

/*
the default lowering: AST -> CFG, then CFG -> SSA. Either step may throw.
 */
public class SsaLowering implements CfgLowering {
    public static final SsaLowering INSTANCE = new SsaLowering();

    @Override
    public Cfg lower(Definition definition, Curve curve, ReportCollection reports) {
        Cfg cfg = new CfgBuilder(definition, curve, reports).build();
        new SsaConverter(cfg).convert();
        return cfg;
    }
}
