package org.pragmatica.scripter.tree;

public sealed interface BindingTarget extends DeclarationName permits Identifier, ArrayBinding, ObjectBinding {
}
