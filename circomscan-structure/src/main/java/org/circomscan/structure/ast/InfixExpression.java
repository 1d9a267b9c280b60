package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

public record InfixExpression(Meta meta, Expression lhs, InfixOperator operator, Expression rhs)
        implements Expression {
}
