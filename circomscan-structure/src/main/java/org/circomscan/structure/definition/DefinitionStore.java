package org.circomscan.structure.definition;

import org.circomscan.structure.file.FileLibrary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
The output of the parser: templates and functions by name, in the order in which they were added,
together with the library of files they were parsed from.
 */
public class DefinitionStore {
    private final FileLibrary fileLibrary;
    private final Map<String, TemplateDefinition> templates;
    private final Map<String, FunctionDefinition> functions;

    private DefinitionStore(FileLibrary fileLibrary,
                            Map<String, TemplateDefinition> templates,
                            Map<String, FunctionDefinition> functions) {
        this.fileLibrary = fileLibrary;
        this.templates = Collections.unmodifiableMap(templates);
        this.functions = Collections.unmodifiableMap(functions);
    }

    public static DefinitionStore empty() {
        return new Builder(new FileLibrary()).build();
    }

    public FileLibrary fileLibrary() {
        return fileLibrary;
    }

    public TemplateDefinition templateOrNull(String name) {
        return templates.get(name);
    }

    public FunctionDefinition functionOrNull(String name) {
        return functions.get(name);
    }

    public Definition definitionOrNull(DefinitionKind kind, String name) {
        return kind == DefinitionKind.TEMPLATE ? templates.get(name) : functions.get(name);
    }

    public boolean isTemplate(String name) {
        return templates.containsKey(name);
    }

    public boolean isFunction(String name) {
        return functions.containsKey(name);
    }

    public List<String> templateNames(boolean userInputOnly) {
        return names(templates, userInputOnly);
    }

    public List<String> functionNames(boolean userInputOnly) {
        return names(functions, userInputOnly);
    }

    public List<String> names(DefinitionKind kind, boolean userInputOnly) {
        return kind == DefinitionKind.TEMPLATE ? templateNames(userInputOnly) : functionNames(userInputOnly);
    }

    // returns a copy, so that callers can iterate while the store's owner is being modified
    private List<String> names(Map<String, ? extends Definition> map, boolean userInputOnly) {
        return map.values().stream()
                .filter(d -> !userInputOnly || fileLibrary.isUserInput(d.fileId()))
                .map(Definition::name)
                .toList();
    }

    public static class Builder {
        private final FileLibrary fileLibrary;
        private final Map<String, TemplateDefinition> templates = new LinkedHashMap<>();
        private final Map<String, FunctionDefinition> functions = new LinkedHashMap<>();

        public Builder(FileLibrary fileLibrary) {
            this.fileLibrary = fileLibrary;
        }

        public Builder addTemplate(TemplateDefinition template) {
            if (templates.putIfAbsent(template.name(), template) != null) {
                throw new IllegalArgumentException("Duplicate template " + template.name());
            }
            return this;
        }

        public Builder addFunction(FunctionDefinition function) {
            if (functions.putIfAbsent(function.name(), function) != null) {
                throw new IllegalArgumentException("Duplicate function " + function.name());
            }
            return this;
        }

        public Builder addDefinition(Definition definition) {
            if (definition instanceof TemplateDefinition td) return addTemplate(td);
            if (definition instanceof FunctionDefinition fd) return addFunction(fd);
            throw new UnsupportedOperationException("Unknown definition type " + definition.getClass());
        }

        public DefinitionStore build() {
            return new DefinitionStore(fileLibrary, new LinkedHashMap<>(templates), new LinkedHashMap<>(functions));
        }
    }
}
