package com.suiterunner.report;

import java.util.Locale;

public enum ReportFormat {
    AUTO, TEXT, HTML;

    public static ReportFormat parse(String value) {
        if (value == null || value.isBlank()) return AUTO;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format: " + value + " (expected auto, text or html)", e);
        }
    }
}
