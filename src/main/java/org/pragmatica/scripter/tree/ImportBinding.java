package org.pragmatica.scripter.tree;

public sealed interface ImportBinding permits NamespaceBinding, NamedImports {
}
