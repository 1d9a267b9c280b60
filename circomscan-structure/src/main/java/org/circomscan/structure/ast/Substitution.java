package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

import java.util.List;

public record Substitution(Meta meta, String variable, List<Expression> access, AssignOperator operator,
                           Expression rhs) implements Statement {

    public Substitution {
        access = List.copyOf(access);
    }

    public Substitution(Meta meta, String variable, AssignOperator operator, Expression rhs) {
        this(meta, variable, List.of(), operator, rhs);
    }
}
