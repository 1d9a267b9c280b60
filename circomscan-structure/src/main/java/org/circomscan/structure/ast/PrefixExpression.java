package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

public record PrefixExpression(Meta meta, PrefixOperator operator, Expression rhs) implements Expression {
}
