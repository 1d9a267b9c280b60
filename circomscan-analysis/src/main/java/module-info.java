module org.circomscan.analysis {
    requires org.circomscan.structure;
    requires org.slf4j;

    exports org.circomscan.analysis;
    exports org.circomscan.analysis.impl;
    exports org.circomscan.analysis.writer;
}
