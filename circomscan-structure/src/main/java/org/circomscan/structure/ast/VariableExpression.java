package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

import java.util.List;

/*
read of a variable, signal or component, possibly indexed: a, a[i], a[i][j]
 */
public record VariableExpression(Meta meta, String name, List<Expression> access) implements Expression {

    public VariableExpression {
        access = List.copyOf(access);
    }

    public VariableExpression(Meta meta, String name) {
        this(meta, name, List.of());
    }
}
