package me.christianrobert.retarget.translator.ast;

/**
 * Expression produced by the parser whose kind lies outside the node model
 * (lambda, comprehension, f-string, ...). It is always emitted as the placeholder token.
 */
public class OpaqueExpression extends Expression {

    private final String kind;

    public OpaqueExpression(String kind) {
        this.kind = requireName(kind, "Expression kind");
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitOpaqueExpression(this);
    }

    @Override
    public String toString() {
        return "OpaqueExpression{kind='" + kind + "'}";
    }
}
