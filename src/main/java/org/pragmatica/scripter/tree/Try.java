package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code try {} catch(e) {} finally {}}; catch and finally parts are optional.
 */
public final class Try extends CodeNode {
    private CodeBlock block;
    private CodeBlock catchBlock;
    private Identifier catchIdentifier;
    private CodeBlock finallyBlock;

    public Try(CodeBlock block, CodeBlock catchBlock, Identifier catchIdentifier, CodeBlock finallyBlock) {
        this.block = block;
        this.catchBlock = catchBlock;
        this.catchIdentifier = catchIdentifier;
        this.finallyBlock = finallyBlock;
    }

    public CodeBlock block() {
        return block;
    }

    public void setBlock(CodeBlock block) {
        this.block = block;
    }

    public CodeBlock catchBlock() {
        return catchBlock;
    }

    public void setCatchBlock(CodeBlock catchBlock) {
        this.catchBlock = catchBlock;
    }

    public Identifier catchIdentifier() {
        return catchIdentifier;
    }

    public void setCatchIdentifier(Identifier catchIdentifier) {
        this.catchIdentifier = catchIdentifier;
    }

    public CodeBlock finallyBlock() {
        return finallyBlock;
    }

    public void setFinallyBlock(CodeBlock finallyBlock) {
        this.finallyBlock = finallyBlock;
    }

    @Override
    protected String buildString() {
        var sb = new StringBuilder("try ").append(block.render());
        if (catchBlock != null) {
            sb.append(" catch");
            if (catchIdentifier != null) {
                sb.append("(").append(catchIdentifier).append(")");
            }
            sb.append(" ").append(catchBlock.render());
        }
        if (finallyBlock != null) {
            sb.append(" finally ").append(finallyBlock.render());
        }
        return sb.toString();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(block);
        result.add(catchBlock);
        result.add(finallyBlock);
        result.add(catchIdentifier);
        return result;
    }

    @Override
    public String statementTerminator() {
        return "";
    }
}
