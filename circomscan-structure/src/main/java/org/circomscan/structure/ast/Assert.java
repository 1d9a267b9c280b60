package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

public record Assert(Meta meta, Expression condition) implements Statement {
}
