package com.suiterunner;

import com.suiterunner.framework.SuiteResult;
import com.suiterunner.framework.TestOutcome;
import com.suiterunner.report.HtmlReporter;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HtmlReporterTest {

    @Test
    void rendersStandalonePageWithGreenBarOnSuccess() {
        String html = render(new SuiteResult("Test Suite: app-test-web", 1, List.of(
            TestOutcome.pass("test.web.PageTest", "testRendersHeading"))));

        assertTrue(html.startsWith("<!DOCTYPE html>"), html);
        assertTrue(html.contains("<title>Test Suite: app-test-web</title>"), html);
        assertTrue(html.contains("background-color: green"), html);
        assertTrue(html.contains("<strong>1</strong> passes"), html);
        assertTrue(html.trim().endsWith("</html>"), html);
    }

    @Test
    void failureMessagesAreEscapedAndBarIsRed() {
        String html = render(new SuiteResult("Test Suite: app-test-web", 1, List.of(
            TestOutcome.fail("test.web.PageTest", "testRendersHeading", "[<h1>] differs from [<h2>]"))));

        assertTrue(html.contains("[&lt;h1&gt;] differs from [&lt;h2&gt;]"), html);
        assertFalse(html.contains("[<h1>]"), html);
        assertTrue(html.contains("background-color: red"), html);
        assertTrue(html.contains("<strong>1</strong> fails"), html);
    }

    @Test
    void escapeHandlesSpecialCharacters() {
        assertEquals("a &amp; b &lt;c&gt; &quot;d&quot; &#39;e&#39;", HtmlReporter.escape("a & b <c> \"d\" 'e'"));
        assertEquals("", HtmlReporter.escape(null));
    }

    private static String render(SuiteResult result) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new HtmlReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8)).render(result);
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
