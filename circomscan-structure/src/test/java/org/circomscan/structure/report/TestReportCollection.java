package org.circomscan.structure.report;

import org.circomscan.structure.file.FileLocation;
import org.circomscan.structure.file.Meta;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestReportCollection {

    private static Report warning(String message) {
        return Report.warning(message, ReportCode.SHADOWING_VARIABLE).build();
    }

    @DisplayName("append moves reports, order is kept")
    @Test
    public void test1() {
        ReportCollection rc1 = ReportCollection.of(warning("a"), warning("b"));
        ReportCollection rc2 = ReportCollection.of(warning("c"));
        rc1.append(rc2);
        assertTrue(rc2.isEmpty());
        assertEquals("abc", rc1.stream().map(Report::message).reduce("", String::concat));

        rc1.append(rc1);
        assertEquals(3, rc1.size());
    }

    @DisplayName("filter on minimum category")
    @Test
    public void test2() {
        ReportCollection rc = ReportCollection.of(
                Report.info("i", ReportCode.ANALYSIS_ERROR).build(),
                warning("w"),
                Report.error("e", ReportCode.ANALYSIS_ERROR).build());
        assertTrue(rc.hasErrors());
        assertEquals(3, rc.filter(MessageCategory.INFO).size());
        assertEquals(2, rc.filter(MessageCategory.WARNING).size());
        ReportCollection errors = rc.filter(MessageCategory.ERROR);
        assertEquals(1, errors.size());
        assertEquals("e", errors.get(0).message());
        assertFalse(rc.filter(MessageCategory.WARNING).filter(MessageCategory.ERROR).isEmpty());
    }

    @DisplayName("report labels and printing")
    @Test
    public void test3() {
        Report report = Report.error("Something is off.", ReportCode.ANALYSIS_ERROR)
                .addPrimary(Meta.of(0, 4, 9), "here")
                .addSecondary(new FileLocation(12, 14), 0, null)
                .addNote("Try again.")
                .build();
        assertTrue(report.isError());
        assertEquals("analysis-error", report.id());
        assertEquals("""
                ERROR [analysis-error]: Something is off.
                  primary 0:4..9 here
                  secondary 0:12..14
                  note: Try again.\
                """, report.toString());
        assertThrows(UnsupportedOperationException.class, () -> report.notes().add("x"));
    }

    @DisplayName("category names")
    @Test
    public void test4() {
        assertEquals(MessageCategory.WARNING, MessageCategory.fromName("warning"));
        assertEquals(MessageCategory.INFO, MessageCategory.fromName("loud"));
        assertTrue(MessageCategory.ERROR.isAtLeast(MessageCategory.WARNING));
        assertFalse(MessageCategory.INFO.isAtLeast(MessageCategory.WARNING));
    }
}
