package me.christianrobert.retarget.translator.ast;

import java.util.List;

public class BinOp extends Expression {

    private final Expression left;
    private final BinaryOperator op;
    private final Expression right;

    public BinOp(Expression left, BinaryOperator op, Expression right) {
        this.left = require(left, "Left operand");
        this.op = require(op, "Operator");
        this.right = require(right, "Right operand");
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOperator getOp() {
        return op;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitBinOp(this);
    }

    @Override
    public String toString() {
        return "BinOp{" + left + " " + op + " " + right + "}";
    }
}
