package me.christianrobert.retarget.translator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Short-circuit chain {@code v1 and v2 and ...} over at least two values.
 */
public class BoolOp extends Expression {

    private final BooleanOperator op;
    private final List<Expression> values;

    public BoolOp(BooleanOperator op, List<Expression> values) {
        this.op = require(op, "Operator");
        this.values = requireList(values, "Operands");
        if (this.values.size() < 2) {
            throw new IllegalArgumentException("Boolean operation needs at least two operands");
        }
    }

    public BooleanOperator getOp() {
        return op;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return new ArrayList<>(values);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitBoolOp(this);
    }

    @Override
    public String toString() {
        return "BoolOp{" + op + ", values=" + values.size() + "}";
    }
}
