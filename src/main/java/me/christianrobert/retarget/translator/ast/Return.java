package me.christianrobert.retarget.translator.ast;

import java.util.List;

/**
 * Return statement; the value is optional.
 */
public class Return extends Statement {

    private final Expression value;

    public Return() {
        this(null);
    }

    public Return(Expression value) {
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return hasValue() ? List.of(value) : List.of();
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    @Override
    public String toString() {
        return hasValue() ? "Return{value=" + value + "}" : "Return{}";
    }
}
