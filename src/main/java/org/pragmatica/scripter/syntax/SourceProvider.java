package org.pragmatica.scripter.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Access to the files of a parsed program.
 */
public interface SourceProvider {
    /**
     * Look up a file by path. Implementations normalize the path with {@link SourceFile#normalize(String)}.
     */
    Optional<SourceFile> sourceFile(String path);

    /**
     * All files of the program in a stable order.
     */
    List<SourceFile> sourceFiles();
}
