package org.pragmatica.scripter.error;

import org.pragmatica.scripter.syntax.SourceSpan;
import org.pragmatica.scripter.syntax.SyntaxKind;

/**
 * Failures the analyzer can report.
 */
public sealed interface AnalysisError {
    String message();

    /**
     * No translation rule exists for the element kind. Lenient analysis recovers from this one.
     */
    record UnsupportedConstruct(
    SyntaxKind kind,
    String text,
    String context,
    SourceSpan span) implements AnalysisError {
        @Override
        public String message() {
            return "Could not analyze " + context + ": found '" + text + "', kind was " + kind;
        }
    }

    /**
     * A required sub-element is absent or has an unexpected shape.
     */
    record MalformedReference(
    SyntaxKind kind,
    String text,
    String expected) implements AnalysisError {
        @Override
        public String message() {
            return "Malformed " + kind + ": expected " + expected + " in '" + text + "'";
        }
    }

    /**
     * The requested file was never registered with the source provider.
     */
    record NullSource(String path) implements AnalysisError {
        @Override
        public String message() {
            return path == null
                   ? "Null source passed to analyzer"
                   : "Source " + path + " could not be found";
        }
    }
}
