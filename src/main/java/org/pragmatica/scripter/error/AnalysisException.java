package org.pragmatica.scripter.error;

/**
 * Raised when analysis of a source file or block cannot proceed.
 */
public class AnalysisException extends ScripterException {
    private final AnalysisError error;

    public AnalysisException(AnalysisError error) {
        super(error.message());
        this.error = error;
    }

    public AnalysisError error() {
        return error;
    }

    public boolean isRecoverable() {
        return error instanceof AnalysisError.UnsupportedConstruct;
    }
}
