package org.circomscan.structure.cfg;

import org.circomscan.structure.report.Report;

public class SsaException extends LoweringException {
    private final SsaError error;

    public SsaException(SsaError error) {
        super(error.toString());
        this.error = error;
    }

    public SsaError getError() {
        return error;
    }

    @Override
    public Report toReport() {
        return error.toReport();
    }
}
