package org.circomscan.structure.ast;

import org.circomscan.structure.file.Meta;

import java.math.BigInteger;

public record NumberExpression(Meta meta, BigInteger value) implements Expression {

    public NumberExpression(Meta meta, long value) {
        this(meta, BigInteger.valueOf(value));
    }
}
