package me.christianrobert.retarget.translator.ast;

import java.util.List;

/**
 * Conditional expression {@code body if test else orelse}.
 */
public class Conditional extends Expression {

    private final Expression test;
    private final Expression body;
    private final Expression orelse;

    public Conditional(Expression test, Expression body, Expression orelse) {
        this.test = require(test, "Condition");
        this.body = require(body, "Value when true");
        this.orelse = require(orelse, "Value when false");
    }

    public Expression getTest() {
        return test;
    }

    public Expression getBody() {
        return body;
    }

    public Expression getOrelse() {
        return orelse;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of(test, body, orelse);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    @Override
    public String toString() {
        return "Conditional{test=" + test + "}";
    }
}
