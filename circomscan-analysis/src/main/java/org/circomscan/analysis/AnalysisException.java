package org.circomscan.analysis;

import org.circomscan.structure.definition.DefinitionKind;
import org.circomscan.structure.file.FileLocation;
import org.circomscan.structure.report.Report;
import org.circomscan.structure.report.ReportCode;

/*
Fatal for the analysis of one definition, never for the whole run.
 */
public class AnalysisException extends RuntimeException {

    public enum Kind {
        UNKNOWN_TEMPLATE, UNKNOWN_FUNCTION,
        FAILED_TO_LIFT_TEMPLATE, FAILED_TO_LIFT_FUNCTION,
        UNKNOWN_FILE, INVALID_LOCATION
    }

    private final Kind kind;
    private final String name;
    private final int fileId;
    private final FileLocation location;

    private AnalysisException(Kind kind, String message, String name, int fileId, FileLocation location,
                              Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.name = name;
        this.fileId = fileId;
        this.location = location;
    }

    public static AnalysisException unknown(DefinitionKind definitionKind, String name) {
        Kind kind = definitionKind == DefinitionKind.TEMPLATE ? Kind.UNKNOWN_TEMPLATE : Kind.UNKNOWN_FUNCTION;
        return new AnalysisException(kind, "Unknown " + definitionKind.keyword() + " `" + name + "`.",
                name, -1, null, null);
    }

    public static AnalysisException failedToLift(DefinitionKind definitionKind, String name, Throwable cause) {
        Kind kind = definitionKind == DefinitionKind.TEMPLATE
                ? Kind.FAILED_TO_LIFT_TEMPLATE : Kind.FAILED_TO_LIFT_FUNCTION;
        return new AnalysisException(kind, "Failed to lift " + definitionKind.keyword() + " `" + name + "`.",
                name, -1, null, cause);
    }

    public static AnalysisException unknownFile(int fileId) {
        return new AnalysisException(Kind.UNKNOWN_FILE, "Unknown file ID " + fileId + ".", null, fileId, null,
                null);
    }

    public static AnalysisException invalidLocation(int fileId, FileLocation location) {
        return new AnalysisException(Kind.INVALID_LOCATION, "The location " + location
                                                             + " is not valid for the file with ID " + fileId + ".",
                null, fileId, location, null);
    }

    public Kind kind() {
        return kind;
    }

    // null for file related errors
    public String name() {
        return name;
    }

    // -1 for definition related errors
    public int fileId() {
        return fileId;
    }

    public FileLocation location() {
        return location;
    }

    public boolean isLiftFailure() {
        return kind == Kind.FAILED_TO_LIFT_TEMPLATE || kind == Kind.FAILED_TO_LIFT_FUNCTION;
    }

    public Report toReport() {
        Report.Builder builder = Report.error(getMessage(), ReportCode.ANALYSIS_ERROR);
        if (location != null) {
            builder.addPrimary(location, fileId, "The problem occurred here.");
        }
        return builder.build();
    }
}
