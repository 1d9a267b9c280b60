package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

public interface Expression {
    Meta meta();
}
