package com.suiterunner.symbols;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Wrapper around JavaParser. Parses source files without symbol resolution;
 * only declarations are needed.
 */
public class JavaSourceParser {

    private final JavaParser parser;

    public JavaSourceParser() {
        ParserConfiguration config = new ParserConfiguration();
        config.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(config);
    }

    /**
     * Parse the given files. Files that cannot be read or parsed are left out of the result.
     * Returns a map of absolute file path -> CompilationUnit, in input order.
     */
    public Map<Path, CompilationUnit> parseFiles(List<Path> files) {
        Map<Path, CompilationUnit> result = new LinkedHashMap<>();
        for (Path file : files) {
            try {
                ParseResult<CompilationUnit> parsed = parser.parse(file);
                if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
                    System.err.println("[suite-runner] Warning: could not parse " + file + ": "
                        + parsed.getProblems().stream().map(Problem::getMessage).collect(Collectors.joining("; ")));
                    continue;
                }
                result.put(file, parsed.getResult().get());
            } catch (IOException e) {
                System.err.println("[suite-runner] Warning: could not read " + file + ": " + e.getMessage());
            }
        }
        return result;
    }
}
