package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

public record While(Meta meta, Expression condition, Statement body) implements Statement {
}
