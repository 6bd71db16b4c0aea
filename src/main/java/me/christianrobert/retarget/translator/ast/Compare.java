package me.christianrobert.retarget.translator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Possibly chained comparison {@code left op1 c1 op2 c2 ...}.
 * There is always exactly one comparator per operator.
 */
public class Compare extends Expression {

    private final Expression left;
    private final List<CompareOperator> ops;
    private final List<Expression> comparators;

    public Compare(Expression left, List<CompareOperator> ops, List<Expression> comparators) {
        this.left = require(left, "Left operand");
        this.ops = requireList(ops, "Comparison operators");
        this.comparators = requireList(comparators, "Comparators");
        if (this.ops.isEmpty() || this.ops.size() != this.comparators.size()) {
            throw new IllegalArgumentException("Comparison needs one comparator per operator, got "
                    + this.ops.size() + " operators and " + this.comparators.size() + " comparators");
        }
    }

    public Expression getLeft() {
        return left;
    }

    public List<CompareOperator> getOps() {
        return ops;
    }

    public List<Expression> getComparators() {
        return comparators;
    }

    public boolean isChained() {
        return ops.size() > 1;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(left);
        children.addAll(comparators);
        return children;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitCompare(this);
    }

    @Override
    public String toString() {
        return "Compare{left=" + left + ", ops=" + ops + "}";
    }
}
