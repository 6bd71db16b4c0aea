package me.christianrobert.retarget.translator.ast;

import java.util.List;

public class Subscript extends Expression {

    private final Expression value;
    private final Expression index;

    public Subscript(Expression value, Expression index) {
        this.value = require(value, "Subscripted value");
        this.index = require(index, "Index");
    }

    public Expression getValue() {
        return value;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of(value, index);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitSubscript(this);
    }

    @Override
    public String toString() {
        return "Subscript{" + value + "[" + index + "]}";
    }
}
