package org.circomscan.analysis.writer;

import org.circomscan.structure.file.FileLibrary;
import org.circomscan.structure.report.MessageCategory;
import org.circomscan.structure.report.Report;
import org.circomscan.structure.report.ReportCollection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/*
Keeps the reports at or above a minimum category in memory, in the order they were written.
 */
public class CachedReportWriter implements ReportWriter {
    private final MessageCategory minimumCategory;
    private final List<String> messages = new ArrayList<>();
    private final ReportCollection reports = new ReportCollection();

    public CachedReportWriter(MessageCategory minimumCategory) {
        this.minimumCategory = minimumCategory;
    }

    @Override
    public void writeMessage(String message) {
        messages.add(message);
    }

    @Override
    public void writeReports(ReportCollection reports, FileLibrary fileLibrary) {
        for (Report report : reports) {
            if (report.category().isAtLeast(minimumCategory)) {
                this.reports.add(report);
            }
        }
    }

    public List<String> messages() {
        return Collections.unmodifiableList(messages);
    }

    public ReportCollection reports() {
        return reports;
    }
}
