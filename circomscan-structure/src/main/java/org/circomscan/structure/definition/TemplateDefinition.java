package org.circomscan.structure.definition;

import org.circomscan.structure.ast.Block;
import org.circomscan.structure.file.Meta;

import java.util.List;

public record TemplateDefinition(Meta meta, String name, List<String> parameters, Block body) implements Definition {

    public TemplateDefinition {
        parameters = List.copyOf(parameters);
    }

    @Override
    public DefinitionKind kind() {
        return DefinitionKind.TEMPLATE;
    }
}
