package org.circomscan.analysis.writer;

import org.circomscan.structure.file.FileLibrary;
import org.circomscan.structure.report.ReportCollection;

public interface ReportWriter {

    // progress information, not a finding
    void writeMessage(String message);

    void writeReports(ReportCollection reports, FileLibrary fileLibrary);
}
