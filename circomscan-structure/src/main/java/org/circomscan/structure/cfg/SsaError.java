package org.circomscan.structure.cfg;

import org.circomscan.structure.file.Meta;
import org.circomscan.structure.report.Report;
import org.circomscan.structure.report.ReportCode;

public interface SsaError {

    Report toReport();

    record UndefinedVariable(String name, Meta meta) implements SsaError {
        @Override
        public Report toReport() {
            return Report.error("Variable `" + name + "` may be read before it is assigned a value.",
                            ReportCode.UNASSIGNED_VARIABLE)
                    .addPrimary(meta, "Variable is read here.")
                    .build();
        }
    }
}
