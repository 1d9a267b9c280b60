package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

public record ConstraintEquality(Meta meta, Expression lhs, Expression rhs) implements Statement {
}
