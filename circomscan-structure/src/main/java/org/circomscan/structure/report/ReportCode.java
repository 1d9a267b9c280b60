package org.circomscan.structure.report;

/*
Stable identifiers for reports. The id is what external consumers (JSON output, suppression comments) refer to;
never change an existing one.
 */
public enum ReportCode {
    UNINITIALIZED_SYMBOL_IN_EXPRESSION("uninitialized-symbol"),
    UNASSIGNED_VARIABLE("unassigned-variable"),
    SHADOWING_VARIABLE("shadowing-variable"),
    PARAMETER_NAME_COLLISION("parameter-name-collision"),
    ANALYSIS_ERROR("analysis-error");

    private final String id;

    ReportCode(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
