package org.circomscan.structure.report;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/*
Order-preserving sequence of reports. Not thread-safe; a collection has a single owner at any time.
 */
public class ReportCollection implements Iterable<Report> {
    private final List<Report> reports;

    public ReportCollection() {
        this.reports = new ArrayList<>();
    }

    public ReportCollection(List<Report> reports) {
        this.reports = new ArrayList<>(reports);
    }

    public static ReportCollection of(Report... reports) {
        return new ReportCollection(List.of(reports));
    }

    public void add(Report report) {
        reports.add(report);
    }

    public void addAll(ReportCollection other) {
        reports.addAll(other.reports);
    }

    /*
    moves all reports of 'other' to the end of this collection; 'other' is empty afterwards
     */
    public void append(ReportCollection other) {
        if (other == this) return;
        reports.addAll(other.reports);
        other.reports.clear();
    }

    public Report get(int index) {
        return reports.get(index);
    }

    public int size() {
        return reports.size();
    }

    public boolean isEmpty() {
        return reports.isEmpty();
    }

    public boolean hasErrors() {
        return reports.stream().anyMatch(Report::isError);
    }

    public ReportCollection filter(MessageCategory minimum) {
        return new ReportCollection(reports.stream().filter(r -> r.category().isAtLeast(minimum)).toList());
    }

    public Stream<Report> stream() {
        return reports.stream();
    }

    public List<Report> toList() {
        return List.copyOf(reports);
    }

    @Override
    public Iterator<Report> iterator() {
        return reports.iterator();
    }

    @Override
    public String toString() {
        return reports.toString();
    }
}
