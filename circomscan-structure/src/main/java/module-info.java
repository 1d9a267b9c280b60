module org.circomscan.structure {
    requires org.slf4j;

    exports org.circomscan.structure.ast;
    exports org.circomscan.structure.cfg;
    exports org.circomscan.structure.constants;
    exports org.circomscan.structure.definition;
    exports org.circomscan.structure.file;
    exports org.circomscan.structure.ir;
    exports org.circomscan.structure.report;
}
