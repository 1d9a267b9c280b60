package org.circomscan.structure.cfg;

import org.circomscan.structure.file.Meta;
import org.circomscan.structure.report.Report;
import org.circomscan.structure.report.ReportCode;

/*
Problems found while building the CFG from the AST. UndefinedVariable aborts the lowering;
the other two are recorded as warnings and lowering continues.
 */
public interface CfgError {

    Report toReport();

    record UndefinedVariable(String name, Meta meta) implements CfgError {
        @Override
        public Report toReport() {
            return Report.error("Variable `" + name + "` is used before it is defined.",
                            ReportCode.UNINITIALIZED_SYMBOL_IN_EXPRESSION)
                    .addPrimary(meta, "Variable is first seen here.")
                    .build();
        }
    }

    record ShadowingVariable(String name, Meta primary, Meta secondary) implements CfgError {
        @Override
        public Report toReport() {
            return Report.warning("Declaration of variable `" + name + "` shadows previous declaration.",
                            ReportCode.SHADOWING_VARIABLE)
                    .addPrimary(primary, "Shadowing declaration here.")
                    .addSecondary(secondary, "Shadowed variable is declared here.")
                    .addNote("Consider renaming the second occurrence of `" + name + "`.")
                    .build();
        }
    }

    // policy-wise a warning, despite the name used in the circom compiler
    record ParameterNameCollision(String name, Meta meta) implements CfgError {
        @Override
        public Report toReport() {
            return Report.warning("Parameter `" + name + "` declared multiple times.",
                            ReportCode.PARAMETER_NAME_COLLISION)
                    .addPrimary(meta, "Parameters declared here.")
                    .addNote("Rename the second occurrence of `" + name + "`.")
                    .build();
        }
    }
}
