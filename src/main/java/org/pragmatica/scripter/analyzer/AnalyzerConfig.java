package org.pragmatica.scripter.analyzer;

import java.util.Objects;

/**
 * Analyzer configuration options.
 *
 * @param mode      reaction to untranslatable elements
 * @param recursive expand nested blocks during analysis instead of leaving them for later
 */
public record AnalyzerConfig(
    AnalysisMode mode,
    boolean recursive
) {
    public static final AnalyzerConfig DEFAULT = new AnalyzerConfig(
        AnalysisMode.LENIENT,
        false
    );

    public AnalyzerConfig {
        Objects.requireNonNull(mode, "mode");
    }

    public boolean isStrict() {
        return mode == AnalysisMode.STRICT;
    }

    public AnalyzerConfig withRecursive(boolean recursive) {
        return new AnalyzerConfig(mode, recursive);
    }
}
