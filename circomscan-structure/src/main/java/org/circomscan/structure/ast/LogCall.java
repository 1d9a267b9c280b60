package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

import java.util.List;

public record LogCall(Meta meta, List<Expression> arguments) implements Statement {

    public LogCall {
        arguments = List.copyOf(arguments);
    }
}
