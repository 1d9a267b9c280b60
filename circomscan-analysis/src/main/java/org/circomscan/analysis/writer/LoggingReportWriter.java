package org.circomscan.analysis.writer;

import org.circomscan.structure.file.FileLibrary;
import org.circomscan.structure.report.MessageCategory;
import org.circomscan.structure.report.Report;
import org.circomscan.structure.report.ReportCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/*
Writes each report as one log line, at the level matching its category.
 */
public class LoggingReportWriter implements ReportWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingReportWriter.class);

    private final MessageCategory minimumCategory;

    public LoggingReportWriter() {
        this(MessageCategory.INFO);
    }

    public LoggingReportWriter(MessageCategory minimumCategory) {
        this.minimumCategory = minimumCategory;
    }

    @Override
    public void writeMessage(String message) {
        LOGGER.debug(message);
    }

    @Override
    public void writeReports(ReportCollection reports, FileLibrary fileLibrary) {
        for (Report report : reports.filter(minimumCategory)) {
            String line = format(report, fileLibrary);
            switch (report.category()) {
                case ERROR -> LOGGER.error(line);
                case WARNING -> LOGGER.warn(line);
                case INFO -> LOGGER.info(line);
            }
        }
    }

    static String format(Report report, FileLibrary fileLibrary) {
        StringBuilder sb = new StringBuilder();
        if (!report.primary().isEmpty()) {
            Report.Label label = report.primary().get(0);
            String fileName = fileLibrary.isKnown(label.fileId()) ? fileLibrary.fileName(label.fileId()) : "?";
            sb.append(fileName).append(':').append(label.location()).append(": ");
        }
        sb.append(report.category().name().toLowerCase()).append(" [").append(report.id()).append("] ")
                .append(report.message());
        return sb.toString();
    }
}
