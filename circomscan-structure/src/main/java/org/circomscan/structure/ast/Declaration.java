package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

import java.util.List;

/*
var x; signal input a[2]; component c[n]; the initial value, if any, follows as a separate Substitution
 */
public record Declaration(Meta meta, VariableType type, String name, List<Expression> dimensions)
        implements Statement {

    public Declaration {
        dimensions = List.copyOf(dimensions);
    }

    public Declaration(Meta meta, VariableType type, String name) {
        this(meta, type, name, List.of());
    }
}
