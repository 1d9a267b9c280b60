package org.circomscan.analysis;

import org.circomscan.analysis.writer.ReportWriter;
import org.circomscan.structure.cfg.Cfg;
import org.circomscan.structure.cfg.CfgLowering;
import org.circomscan.structure.constants.Curve;
import org.circomscan.structure.file.FileLibrary;

import java.util.List;

/*
Lowers templates and functions on demand, caches their CFGs, and runs the analysis passes over them.

The CFG being analyzed is taken out of its cache for the duration of the analysis, and put back afterwards.
Should the definition be lowered again in the meantime (a recursive template or function asks for itself),
the CFG written last wins.
 */
public interface AnalysisRunner extends AnalysisContext {

    interface Configuration {
        Curve curve();

        List<AnalysisPass> analysisPasses();

        CfgLowering lowering();
    }

    Configuration configuration();

    FileLibrary fileLibrary();

    List<String> templateNames(boolean userInputOnly);

    List<String> functionNames(boolean userInputOnly);

    void analyzeTemplates(ReportWriter writer, boolean userInputOnly);

    void analyzeFunctions(ReportWriter writer, boolean userInputOnly);

    void analyzeTemplate(String name, ReportWriter writer);

    void analyzeFunction(String name, ReportWriter writer);

    Checkout takeTemplate(String name);

    Checkout takeFunction(String name);

    /*
    returns true when the slot was filled already, i.e. the CFG was regenerated while it was taken out
     */
    boolean replaceTemplate(String name, Cfg cfg);

    boolean replaceFunction(String name, Cfg cfg);
}
