package org.pragmatica.scripter.analyzer;

/**
 * How the analyzer reacts to an element it has no translation rule for.
 */
public enum AnalysisMode {
    /**
     * Fail the enclosing block. The block stays unanalyzed.
     */
    STRICT,

    /**
     * Keep the element as literal text, log a warning and continue.
     */
    LENIENT
}
