package org.circomscan.structure.cfg;

import org.circomscan.structure.report.Report;

public class CfgException extends LoweringException {
    private final CfgError error;

    public CfgException(CfgError error) {
        super(error.toString());
        this.error = error;
    }

    public CfgError getError() {
        return error;
    }

    @Override
    public Report toReport() {
        return error.toReport();
    }
}
