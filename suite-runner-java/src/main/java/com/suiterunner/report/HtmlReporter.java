package com.suiterunner.report;

import com.suiterunner.framework.Reporter;
import com.suiterunner.framework.SuiteResult;
import com.suiterunner.framework.TestOutcome;

import java.io.PrintStream;

/**
 * Renders a suite as a standalone HTML page, for results served by a web server.
 */
public class HtmlReporter implements Reporter {

    private final PrintStream out;

    public HtmlReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void render(SuiteResult result) {
        String title = escape(result.title());
        out.println("<!DOCTYPE html>");
        out.println("<html>");
        out.println("<head><meta charset=\"UTF-8\"><title>" + title + "</title>");
        out.println("<style>.fail { background-color: inherit; color: red; }"
            + " .pass { color: green; } pre { background-color: lightgray; color: inherit; }</style>");
        out.println("</head>");
        out.println("<body>");
        out.println("<h1>" + title + "</h1>");

        for (TestOutcome outcome : result.outcomes()) {
            if (outcome.status() == TestOutcome.Status.PASS) continue;
            String kind = outcome.status() == TestOutcome.Status.FAIL ? "Fail" : "Exception";
            StringBuilder line = new StringBuilder("<span class=\"fail\">").append(kind).append("</span>: ");
            line.append(escape(outcome.testCase()));
            if (outcome.method() != null) {
                line.append(" -&gt; ").append(escape(outcome.method()));
            }
            line.append(" -&gt; ").append(escape(outcome.message())).append("<br />");
            out.println(line);
        }

        String colour = result.isSuccessful() ? "green" : "red";
        out.println("<div style=\"padding: 8px; margin-top: 1em; background-color: " + colour + "; color: white;\">"
            + result.testCaseCount() + "/" + result.testCaseCount() + " test cases complete:"
            + " <strong>" + result.passes() + "</strong> passes,"
            + " <strong>" + result.failures() + "</strong> fails and"
            + " <strong>" + result.exceptions() + "</strong> exceptions."
            + "</div>");
        out.println("</body>");
        out.println("</html>");
        out.flush();
    }

    public static String escape(String text) {
        if (text == null) return "";
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<'  -> sb.append("&lt;");
                case '>'  -> sb.append("&gt;");
                case '&'  -> sb.append("&amp;");
                case '"'  -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default   -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
