package com.intervista.core.model;

/**
 * Requested depth of a session: QUICK skips visual analysis.
 */
public enum AnalysisMode {
    QUICK,
    FULL
}
