package com.suiterunner.report;

import java.io.PrintStream;
import java.util.function.Function;

/**
 * Picks the reporter flavour. {@link ReportFormat#AUTO} asks the execution context:
 * a CGI/web server context gets HTML, anything else gets plain text.
 */
public class ReporterSelector {

    public static final String GATEWAY_VARIABLE = "GATEWAY_INTERFACE";

    private final Function<String, String> environment;
    private final PrintStream out;

    public ReporterSelector(PrintStream out) {
        this(System::getenv, out);
    }

    public ReporterSelector(Function<String, String> environment, PrintStream out) {
        this.environment = environment;
        this.out = out;
    }

    public boolean isInteractiveContext() {
        String gateway = environment.apply(GATEWAY_VARIABLE);
        return gateway == null || gateway.isBlank();
    }

    public ReportFormat resolve(ReportFormat format) {
        if (format != ReportFormat.AUTO) return format;
        return isInteractiveContext() ? ReportFormat.TEXT : ReportFormat.HTML;
    }

    public ReporterFactory select(ReportFormat format) {
        return switch (resolve(format)) {
            case HTML -> () -> new HtmlReporter(out);
            default   -> () -> new TextReporter(out);
        };
    }
}
