package com.suiterunner;

import com.suiterunner.report.ReportFormat;
import com.suiterunner.report.ReporterFactory;
import com.suiterunner.report.ReporterSelector;
import com.suiterunner.runner.TestRunner;
import com.suiterunner.settings.RunnerSettings;
import com.suiterunner.settings.SettingsReader;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Entry point of the test runner.
 *
 * Usage:
 *   java -jar suite-runner-java.jar run \
 *     [--settings <path-to-settings.json>] \
 *     [--lib <dir>] [--app <dir>] [--test-dir <name>] \
 *     [--format auto|text|html]
 *
 * One of --settings or --lib is required; flags override the settings file.
 */
public class RunnerMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[suite-runner] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar suite-runner-java.jar run " +
                               "[--settings <file>] [--lib <dir>] [--app <dir>] " +
                               "[--test-dir <name>] [--format auto|text|html]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[suite-runner] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        RunnerSettings settings = parse(args);
        ReporterFactory reporters = new ReporterSelector(System.out)
            .select(ReportFormat.parse(settings.getReportFormat()));

        System.err.println("[suite-runner] Running tests under: " + settings.resolveLibPath()
            + settings.resolveAppPath().map(p -> " and " + p).orElse(""));
        new TestRunner(settings, reporters).runAll();
        System.err.println("[suite-runner] Done.");
    }

    static RunnerSettings parse(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("run")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String settingsPath = null;
        String lib = null;
        String app = null;
        String testDir = null;
        String format = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--settings" -> settingsPath = requireNext(args, i++, "--settings");
                case "--lib"      -> lib          = requireNext(args, i++, "--lib");
                case "--app"      -> app          = requireNext(args, i++, "--app");
                case "--test-dir" -> testDir      = requireNext(args, i++, "--test-dir");
                case "--format"   -> format       = requireNext(args, i++, "--format");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (settingsPath == null && lib == null) {
            throw new UsageException("--settings or --lib is required");
        }
        if (format != null) {
            try {
                ReportFormat.parse(format);
            } catch (IllegalArgumentException e) {
                throw new UsageException(e.getMessage());
            }
        }

        RunnerSettings settings = settingsPath != null
            ? new SettingsReader().read(Paths.get(settingsPath))
            : RunnerSettings.of(Path.of(lib), null);

        // Flags given on the command line resolve against the working directory.
        Path cwd = Path.of("").toAbsolutePath();
        if (lib != null)     settings.withLibPath(cwd.resolve(lib).toString());
        if (app != null)     settings.withAppPath(cwd.resolve(app).toString());
        if (testDir != null) settings.withTestDir(testDir);
        if (format != null)  settings.withReportFormat(format);
        return settings;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
