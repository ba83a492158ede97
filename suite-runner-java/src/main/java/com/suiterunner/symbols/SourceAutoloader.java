package com.suiterunner.symbols;

import com.suiterunner.framework.TestCase;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Makes the types listed in one or more {@link SymbolMap}s loadable.
 *
 * {@link #register()} compiles every mapped source file in-process into a
 * scratch directory and opens a class loader over it. The parent loader is the
 * one that loaded {@link TestCase}, so compiled tests share the framework types.
 */
public class SourceAutoloader implements TypeLoader, AutoCloseable {

    private final List<SymbolMap> maps = new ArrayList<>();
    private final List<String> extraClasspath;
    private Path outputDir;
    private URLClassLoader loader;

    public SourceAutoloader() {
        this(List.of());
    }

    public SourceAutoloader(List<String> extraClasspath) {
        this.extraClasspath = List.copyOf(extraClasspath);
    }

    public void addSymbolMap(SymbolMap map) {
        if (loader != null) {
            throw new IllegalStateException("Symbol maps must be added before register()");
        }
        maps.add(map);
    }

    public List<SymbolMap> getSymbolMaps() {
        return List.copyOf(maps);
    }

    public boolean isRegistered() {
        return loader != null;
    }

    /**
     * Compiles the mapped sources and attaches the class loader.
     *
     * @return false if no compiler is available or compilation fails
     */
    public boolean register() {
        if (loader != null) return true;

        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            System.err.println("[suite-runner] No system Java compiler available; run on a JDK, not a JRE");
            return false;
        }

        Set<Path> sources = new LinkedHashSet<>();
        for (SymbolMap map : maps) sources.addAll(map.files());

        try {
            outputDir = Files.createTempDirectory("suite-runner-classes");
            if (!sources.isEmpty() && !compile(compiler, sources)) {
                return false;
            }
            List<URL> urls = new ArrayList<>();
            urls.add(outputDir.toUri().toURL());
            for (String entry : extraClasspath) urls.add(Paths.get(entry).toUri().toURL());
            loader = new URLClassLoader(urls.toArray(new URL[0]), TestCase.class.getClassLoader());
            System.err.println("[suite-runner] Autoloader attached: " + sources.size() + " source files compiled");
            return true;
        } catch (IOException e) {
            System.err.println("[suite-runner] Could not prepare class output directory: " + e.getMessage());
            return false;
        }
    }

    @Override
    public Class<?> load(String typeName) throws ClassNotFoundException {
        if (loader == null) {
            throw new IllegalStateException("Autoloader is not registered");
        }
        return Class.forName(typeName, false, loader);
    }

    @Override
    public Set<String> reverseLookup(Path file) {
        Set<String> types = new LinkedHashSet<>();
        for (SymbolMap map : maps) types.addAll(map.reverseLookup(file));
        return types;
    }

    @Override
    public void close() {
        if (loader != null) {
            try {
                loader.close();
            } catch (IOException e) {
                System.err.println("[suite-runner] Warning: could not close class loader: " + e.getMessage());
            }
            loader = null;
        }
        if (outputDir != null) {
            deleteRecursively(outputDir);
            outputDir = null;
        }
    }

    private boolean compile(JavaCompiler compiler, Set<Path> sources) throws IOException {
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager fileManager =
                 compiler.getStandardFileManager(diagnostics, null, StandardCharsets.UTF_8)) {
            List<Path> paths = new ArrayList<>(sources);
            Iterable<? extends JavaFileObject> units = fileManager.getJavaFileObjectsFromPaths(paths);
            List<String> options = List.of(
                "-d", outputDir.toString(),
                "-classpath", compileClasspath(),
                "-proc:none",
                "-nowarn",
                "-encoding", "UTF-8"
            );
            boolean ok = compiler.getTask(null, fileManager, diagnostics, options, null, units).call();
            if (!ok) {
                for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
                    if (d.getKind() == Diagnostic.Kind.ERROR) {
                        String source = d.getSource() != null ? d.getSource().getName() : "<unknown>";
                        System.err.println("[suite-runner] COMPILE: " + source + ":" + d.getLineNumber()
                            + ": " + d.getMessage(null));
                    }
                }
            }
            return ok;
        }
    }

    private String compileClasspath() {
        Set<String> entries = new LinkedHashSet<>();
        frameworkLocation().ifPresent(entries::add);
        String javaClassPath = System.getProperty("java.class.path");
        if (javaClassPath != null && !javaClassPath.isBlank()) {
            for (String entry : javaClassPath.split(File.pathSeparator)) {
                if (!entry.isBlank()) entries.add(entry);
            }
        }
        entries.addAll(extraClasspath);
        return String.join(File.pathSeparator, entries);
    }

    private static Optional<String> frameworkLocation() {
        CodeSource codeSource = TestCase.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) return Optional.empty();
        try {
            return Optional.of(Paths.get(codeSource.getLocation().toURI()).toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            System.err.println("[suite-runner] Warning: could not delete " + dir + ": " + e.getMessage());
        }
    }
}
