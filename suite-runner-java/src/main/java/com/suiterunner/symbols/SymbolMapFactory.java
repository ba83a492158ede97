package com.suiterunner.symbols;

import com.github.javaparser.ast.CompilationUnit;
import com.suiterunner.discovery.SourceFileEnumerator;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link SymbolMap} by parsing every Java source file under a root.
 */
public class SymbolMapFactory {

    private final SourceFileEnumerator enumerator;
    private final JavaSourceParser parser;

    public SymbolMapFactory() {
        this(new SourceFileEnumerator(), new JavaSourceParser());
    }

    public SymbolMapFactory(SourceFileEnumerator enumerator, JavaSourceParser parser) {
        this.enumerator = enumerator;
        this.parser = parser;
    }

    public SymbolMap generate(Path root, String mapId) {
        Path absoluteRoot = root.toAbsolutePath().normalize();
        List<Path> sources = enumerator.enumerate(absoluteRoot);
        Map<Path, CompilationUnit> units = parser.parseFiles(sources);

        Map<String, Path> typeToFile = new LinkedHashMap<>();
        for (Map.Entry<Path, CompilationUnit> entry : units.entrySet()) {
            for (String typeName : TypeDeclarationCollector.collect(entry.getValue())) {
                Path previous = typeToFile.putIfAbsent(typeName, entry.getKey());
                if (previous != null) {
                    System.err.println("[suite-runner] Warning: " + typeName + " declared in both "
                        + previous + " and " + entry.getKey() + "; keeping the first");
                }
            }
        }

        System.err.println("[suite-runner] Built " + mapId + ": " + typeToFile.size()
            + " types in " + units.size() + " files under " + absoluteRoot);
        return new SymbolMap(mapId, absoluteRoot, typeToFile);
    }
}
