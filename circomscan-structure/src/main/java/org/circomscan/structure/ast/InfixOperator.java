package org.circomscan.structure.ast;

import java.math.BigInteger;

public enum InfixOperator {
    MUL("*"), DIV("/"), ADD("+"), SUB("-"), POW("**"), INT_DIV("\\"), MOD("%"),
    SHIFT_L("<<"), SHIFT_R(">>"),
    LESSER_EQ("<="), GREATER_EQ(">="), LESSER("<"), GREATER(">"), EQ("=="), NOT_EQ("!="),
    BOOL_OR("||"), BOOL_AND("&&"),
    BIT_OR("|"), BIT_AND("&"), BIT_XOR("^");

    private final String symbol;

    InfixOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /*
    field arithmetic on two constants; null when this operator is not folded during lowering
     */
    public BigInteger fold(BigInteger lhs, BigInteger rhs, BigInteger prime) {
        return switch (this) {
            case ADD -> lhs.add(rhs).mod(prime);
            case SUB -> lhs.subtract(rhs).mod(prime);
            case MUL -> lhs.multiply(rhs).mod(prime);
            default -> null;
        };
    }
}
