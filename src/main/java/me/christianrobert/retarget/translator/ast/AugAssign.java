package me.christianrobert.retarget.translator.ast;

import java.util.List;

/**
 * Compound assignment such as {@code total += x}.
 */
public class AugAssign extends Statement {

    private final Expression target;
    private final BinaryOperator op;
    private final Expression value;

    public AugAssign(Expression target, BinaryOperator op, Expression value) {
        this.target = require(target, "Assignment target");
        this.op = require(op, "Operator");
        this.value = require(value, "Assignment value");
    }

    public Expression getTarget() {
        return target;
    }

    public BinaryOperator getOp() {
        return op;
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
        return visitor.visitAugAssign(this);
    }

    @Override
    public String toString() {
        return "AugAssign{target=" + target + ", op=" + op + ", value=" + value + "}";
    }
}
