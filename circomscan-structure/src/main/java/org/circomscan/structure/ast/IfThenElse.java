package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

/*
elseCase is null when there is no else branch
 */
public record IfThenElse(Meta meta, Expression condition, Statement ifCase, Statement elseCase)
        implements Statement {
}
