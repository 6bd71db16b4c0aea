package me.christianrobert.retarget.translator.ast;

import java.util.List;

/**
 * Single-target assignment {@code target = value}.
 */
public class Assign extends Statement {

    private final Expression target;
    private final Expression value;

    public Assign(Expression target, Expression value) {
        this.target = require(target, "Assignment target");
        this.value = require(value, "Assignment value");
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of(target, value);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }

    @Override
    public String toString() {
        return "Assign{target=" + target + ", value=" + value + "}";
    }
}
