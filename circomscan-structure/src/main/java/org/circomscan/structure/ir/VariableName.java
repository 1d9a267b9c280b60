package org.circomscan.structure.ir;

import java.util.Objects;

/*
name of a variable in the IR; after SSA conversion, local variables carry a version: x.0, x.1, ...
 */
public record VariableName(String name, Integer version) {

    public VariableName {
        Objects.requireNonNull(name);
    }

    public static VariableName of(String name) {
        return new VariableName(name, null);
    }

    public boolean hasVersion() {
        return version != null;
    }

    @Override
    public String toString() {
        return version == null ? name : name + "." + version;
    }
}
