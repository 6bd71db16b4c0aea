package me.christianrobert.retarget.translator.ast;

/**
 * Statement produced by the parser whose kind lies outside the node model
 * (try, with, global, ...). It is always emitted as the placeholder token.
 */
public class OpaqueStatement extends Statement {

    private final String kind;

    public OpaqueStatement(String kind) {
        this.kind = requireName(kind, "Statement kind");
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitOpaqueStatement(this);
    }

    @Override
    public String toString() {
        return "OpaqueStatement{kind='" + kind + "'}";
    }
}
