package org.circomscan.structure.ast;

public enum AssignOperator {
    ASSIGN_VARIABLE("="), ASSIGN_SIGNAL("<--"), ASSIGN_CONSTRAINT_SIGNAL("<==");

    private final String symbol;

    AssignOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
