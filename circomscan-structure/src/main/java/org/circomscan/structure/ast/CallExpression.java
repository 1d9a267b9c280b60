package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

import java.util.List;

/*
call of a function, or instantiation of a template
 */
public record CallExpression(Meta meta, String name, List<Expression> arguments) implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }
}
