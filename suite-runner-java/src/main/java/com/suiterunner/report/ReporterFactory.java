package com.suiterunner.report;

import com.suiterunner.framework.Reporter;

/**
 * Creates a fresh reporter for each suite run.
 */
@FunctionalInterface
public interface ReporterFactory {

    Reporter create();
}
