package org.circomscan.analysis;

import org.circomscan.structure.cfg.Cfg;
import org.circomscan.structure.report.ReportCollection;

/*
A CFG taken out of the cache, together with the reports produced while lowering it.
The holder owns both until the CFG is put back with replace().
 */
public record Checkout(Cfg cfg, ReportCollection reports) {
}
