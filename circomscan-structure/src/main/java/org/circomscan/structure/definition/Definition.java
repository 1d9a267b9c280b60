package org.circomscan.structure.definition;

import org.circomscan.structure.ast.Block;
import org.circomscan.structure.file.Meta;

import java.util.List;

/*
A template or a function, as produced by the parser. Immutable.
 */
public interface Definition {

    Meta meta();

    String name();

    List<String> parameters();

    Block body();

    DefinitionKind kind();

    default int fileId() {
        return meta().fileId();
    }
}
