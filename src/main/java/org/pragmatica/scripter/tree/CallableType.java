package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * Function type, e.g. {@code (x: number)=>string} or {@code new(x)=>Foo}.
 */
public final class CallableType extends Signature implements TypeNode {
    public CallableType() {
    }

    public CallableType(DeclarationName name, List<Property> parameters, TypeNode returnType,
                        List<TypeParameter> typeParameters, boolean optional) {
        super(name, parameters, returnType, typeParameters, optional);
    }

    @Override
    protected boolean isPropertyType() {
        return true;
    }
}
