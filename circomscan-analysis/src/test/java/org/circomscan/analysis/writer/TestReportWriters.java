package org.circomscan.analysis.writer;

import org.circomscan.analysis.AnalysisException;
import org.circomscan.structure.definition.DefinitionKind;
import org.circomscan.structure.file.FileLibrary;
import org.circomscan.structure.file.Meta;
import org.circomscan.structure.report.MessageCategory;
import org.circomscan.structure.report.Report;
import org.circomscan.structure.report.ReportCode;
import org.circomscan.structure.report.ReportCollection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestReportWriters {

    private final FileLibrary fileLibrary = new FileLibrary();

    private ReportCollection reports() {
        int id = fileLibrary.addFile("main.circom", "template Main() {}", true);
        return ReportCollection.of(
                Report.info("Just so you know.", ReportCode.ANALYSIS_ERROR).build(),
                Report.warning("Declaration of variable `x` shadows previous declaration.",
                        ReportCode.SHADOWING_VARIABLE).addPrimary(Meta.of(id, 9, 13), "here").build(),
                AnalysisException.unknown(DefinitionKind.TEMPLATE, "Missing").toReport());
    }

    @Test
    public void testCached() {
        CachedReportWriter writer = new CachedReportWriter(MessageCategory.WARNING);
        writer.writeMessage("analyzing template 'Main'");
        writer.writeReports(reports(), fileLibrary);
        assertEquals(2, writer.reports().size());
        assertEquals(List.of("shadowing-variable", "analysis-error"),
                writer.reports().stream().map(Report::id).toList());
        assertEquals("Unknown template `Missing`.", writer.reports().get(1).message());
        assertEquals(List.of("analyzing template 'Main'"), writer.messages());
    }

    @Test
    public void testLogging() {
        ReportCollection reports = reports();
        assertEquals("main.circom:9..13: warning [shadowing-variable] "
                     + "Declaration of variable `x` shadows previous declaration.",
                LoggingReportWriter.format(reports.get(1), fileLibrary));
        assertEquals("error [analysis-error] Unknown template `Missing`.",
                LoggingReportWriter.format(reports.get(2), fileLibrary));

        LoggingReportWriter writer = new LoggingReportWriter(MessageCategory.ERROR);
        writer.writeMessage("analyzing template 'Main'");
        writer.writeReports(reports, fileLibrary);
    }
}
