package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * Signature of functions, methods, lambdas and callable interface members, e.g. {@code run(x: number):string}.
 */
public final class CallableSignature extends Signature implements Member {
    public CallableSignature() {
    }

    public CallableSignature(DeclarationName name, List<Property> parameters, TypeNode returnType,
                             List<TypeParameter> typeParameters, boolean optional) {
        super(name, parameters, returnType, typeParameters, optional);
    }

    @Override
    protected boolean isPropertyType() {
        return false;
    }
}
