package org.circomscan.structure.cfg;

import org.circomscan.structure.ast.VariableType;
import org.circomscan.structure.definition.DefinitionKind;
import org.circomscan.structure.file.Meta;
import org.circomscan.structure.ir.IrStatement;
import org.circomscan.structure.ir.VariableName;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/*
Control flow graph of one template or function. Block 0 is the entry block.
Variable types are keyed by the unversioned (but unique) variable name.
 */
public class Cfg implements Iterable<BasicBlock> {
    private final String name;
    private final DefinitionKind kind;
    private final Meta meta;
    private final Map<String, VariableType> variableTypes;
    private final List<BasicBlock> blocks;
    private List<VariableName> parameters;
    private boolean ssa;

    Cfg(String name, DefinitionKind kind, Meta meta, List<VariableName> parameters,
        Map<String, VariableType> variableTypes, List<BasicBlock> blocks) {
        assert !blocks.isEmpty() : "A CFG has at least an entry block";
        this.name = name;
        this.kind = kind;
        this.meta = meta;
        this.parameters = List.copyOf(parameters);
        this.variableTypes = Collections.unmodifiableMap(variableTypes);
        this.blocks = List.copyOf(blocks);
    }

    public String name() {
        return name;
    }

    public DefinitionKind kind() {
        return kind;
    }

    public Meta meta() {
        return meta;
    }

    public List<VariableName> parameters() {
        return parameters;
    }

    public BasicBlock entryBlock() {
        return blocks.get(0);
    }

    public BasicBlock block(int index) {
        return blocks.get(index);
    }

    public List<BasicBlock> blocks() {
        return blocks;
    }

    public int size() {
        return blocks.size();
    }

    public boolean isSsa() {
        return ssa;
    }

    public VariableType variableTypeOrNull(VariableName variableName) {
        return variableTypes.get(variableName.name());
    }

    public boolean isLocal(VariableName variableName) {
        VariableType type = variableTypeOrNull(variableName);
        return type != null && type.isLocal();
    }

    public Map<String, VariableType> variableTypes() {
        return variableTypes;
    }

    public Stream<IrStatement> statementStream() {
        return blocks.stream().flatMap(b -> b.statements().stream());
    }

    void markSsa(List<VariableName> versionedParameters) {
        this.parameters = List.copyOf(versionedParameters);
        this.ssa = true;
    }

    @Override
    public Iterator<BasicBlock> iterator() {
        return blocks.iterator();
    }

    @Override
    public String toString() {
        return kind.keyword() + " " + name
               + parameters.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"))
               + blocks.stream().map(b -> "\n  " + b).collect(Collectors.joining());
    }
}
