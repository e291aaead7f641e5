package org.pragmatica.scripter.tree;

/**
 * Root of a file. The rendering always ends with a newline.
 */
public final class Source extends StatementBlock {
    private final String fileName;

    public Source(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }

    @Override
    protected String buildString() {
        var result = super.buildString();
        return result.endsWith("\n") ? result : result + "\n";
    }
}
