package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

import java.util.List;

public record Block(Meta meta, List<Statement> statements) implements Statement {

    public Block {
        statements = List.copyOf(statements);
    }
}
