package org.circomscan.structure.ast;

import java.math.BigInteger;

public enum PrefixOperator {
    SUB("-"), BOOL_NOT("!"), COMPLEMENT("~");

    private final String symbol;

    PrefixOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public BigInteger fold(BigInteger value, BigInteger prime) {
        if (this == SUB) return value.negate().mod(prime);
        return null;
    }
}
