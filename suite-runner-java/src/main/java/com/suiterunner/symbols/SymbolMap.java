package com.suiterunner.symbols;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps declared type names to the source file that declares them, and back.
 * Built once per source root; read-only afterwards.
 */
public class SymbolMap {

    private final String id;
    private final Path root;
    private final Map<String, Path> typeToFile;
    private final Map<Path, Set<String>> fileToTypes;

    SymbolMap(String id, Path root, Map<String, Path> typeToFile) {
        this.id = id;
        this.root = root;
        this.typeToFile = Collections.unmodifiableMap(new LinkedHashMap<>(typeToFile));
        Map<Path, Set<String>> reverse = new LinkedHashMap<>();
        typeToFile.forEach((type, file) -> reverse.computeIfAbsent(file, f -> new LinkedHashSet<>()).add(type));
        reverse.replaceAll((file, types) -> Collections.unmodifiableSet(types));
        this.fileToTypes = Collections.unmodifiableMap(reverse);
    }

    public String getId()   { return id; }
    public Path getRoot()   { return root; }
    public int size()       { return typeToFile.size(); }

    public Set<String> types()  { return typeToFile.keySet(); }
    public Set<Path> files()    { return fileToTypes.keySet(); }

    public Optional<Path> lookup(String typeName) {
        return Optional.ofNullable(typeToFile.get(typeName));
    }

    /**
     * Type names declared in the given file, in declaration order. Empty if the
     * file is unknown or declares nothing.
     */
    public Set<String> reverseLookup(Path file) {
        return fileToTypes.getOrDefault(file.toAbsolutePath().normalize(), Collections.emptySet());
    }
}
