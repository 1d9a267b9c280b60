package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

public record Return(Meta meta, Expression value) implements Statement {
}
