package org.circomscan.structure.definition;

public enum DefinitionKind {
    TEMPLATE("template"), FUNCTION("function");

    private final String keyword;

    DefinitionKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
