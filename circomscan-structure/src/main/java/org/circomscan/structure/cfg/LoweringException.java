package org.circomscan.structure.cfg;

import org.circomscan.structure.report.Report;

/*
Fatal problem while lowering a definition to an SSA CFG. Carries the diagnostic explaining it.
 */
public abstract class LoweringException extends RuntimeException {

    protected LoweringException(String message) {
        super(message);
    }

    public abstract Report toReport();
}
