package me.christianrobert.retarget.translator.ast;

import java.util.List;

public class UnaryOp extends Expression {

    private final UnaryOperator op;
    private final Expression operand;

    public UnaryOp(UnaryOperator op, Expression operand) {
        this.op = require(op, "Operator");
        this.operand = require(operand, "Operand");
    }

    public UnaryOperator getOp() {
        return op;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public String toString() {
        return "UnaryOp{" + op + " " + operand + "}";
    }
}
