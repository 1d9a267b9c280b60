package org.circomscan.structure.ast;

public enum VariableType {
    LOCAL("var"),
    INPUT_SIGNAL("signal input"),
    OUTPUT_SIGNAL("signal output"),
    INTERMEDIATE_SIGNAL("signal"),
    COMPONENT("component");

    private final String keyword;

    VariableType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    // only local variables are converted to SSA form
    public boolean isLocal() {
        return this == LOCAL;
    }
}
