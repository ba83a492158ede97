package com.suiterunner.settings;

import com.google.gson.annotations.SerializedName;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Deserialized form of the runner settings JSON file.
 * Relative paths are resolved against {@link #getBaseDir()}.
 */
public class RunnerSettings {

    @SerializedName("lib_path")
    private String libPath;

    /** Optional second source tree; no app suites run when absent. */
    @SerializedName("app_path")
    private String appPath;

    @SerializedName("test_dir")
    private String testDir;

    /** Extra classpath entries handed to the compiler and class loader. */
    @SerializedName("classpath")
    private List<String> classpath;

    /** One of auto, text, html (default: auto). */
    @SerializedName("report_format")
    private String reportFormat;

    private transient Path baseDir;

    private RunnerSettings() {}

    public RunnerSettings(String libPath, String appPath, String testDir,
                          List<String> classpath, String reportFormat) {
        this.libPath = libPath;
        this.appPath = appPath;
        this.testDir = testDir;
        this.classpath = classpath;
        this.reportFormat = reportFormat;
    }

    public static RunnerSettings of(Path libPath, Path appPath) {
        return new RunnerSettings(
            libPath.toString(),
            appPath != null ? appPath.toString() : null,
            null, null, null);
    }

    public String getLibPath()          { return libPath; }
    public String getTestDir()          { return testDir != null && !testDir.isBlank() ? testDir : "test"; }
    public List<String> getClasspath()  { return classpath != null ? classpath : Collections.emptyList(); }
    public String getReportFormat()     { return reportFormat != null ? reportFormat : "auto"; }
    public Path getBaseDir()            { return baseDir != null ? baseDir : Path.of("").toAbsolutePath(); }

    public Optional<String> getAppPath() {
        return appPath == null || appPath.isBlank() ? Optional.empty() : Optional.of(appPath);
    }

    public Path resolveLibPath() {
        return resolve(libPath);
    }

    public Optional<Path> resolveAppPath() {
        return getAppPath().map(this::resolve);
    }

    /** Classpath entries with relative ones resolved against the base directory. */
    public List<String> resolveClasspath() {
        return getClasspath().stream().map(entry -> resolve(entry).toString()).collect(Collectors.toList());
    }

    public RunnerSettings withBaseDir(Path baseDir) {
        this.baseDir = baseDir;
        return this;
    }

    public RunnerSettings withLibPath(String libPath) {
        this.libPath = libPath;
        return this;
    }

    public RunnerSettings withAppPath(String appPath) {
        this.appPath = appPath;
        return this;
    }

    public RunnerSettings withTestDir(String testDir) {
        this.testDir = testDir;
        return this;
    }

    public RunnerSettings withReportFormat(String reportFormat) {
        this.reportFormat = reportFormat;
        return this;
    }

    private Path resolve(String path) {
        return getBaseDir().resolve(path).toAbsolutePath().normalize();
    }
}
