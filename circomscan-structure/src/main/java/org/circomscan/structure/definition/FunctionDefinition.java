package org.circomscan.structure.definition;

import org.circomscan.structure.ast.Block;
import org.circomscan.structure.file.Meta;

import java.util.List;

public record FunctionDefinition(Meta meta, String name, List<String> parameters, Block body) implements Definition {

    public FunctionDefinition {
        parameters = List.copyOf(parameters);
    }

    @Override
    public DefinitionKind kind() {
        return DefinitionKind.FUNCTION;
    }
}
