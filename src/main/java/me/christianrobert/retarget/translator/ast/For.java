package me.christianrobert.retarget.translator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Iteration {@code for var in iterable}.
 */
public class For extends Statement {

    private final Expression var;
    private final Expression iterable;
    private final List<Statement> body;

    public For(Expression var, Expression iterable, List<Statement> body) {
        this.var = require(var, "Loop variable");
        this.iterable = require(iterable, "Loop iterable");
        this.body = requireList(body, "Loop body");
    }

    public Expression getVar() {
        return var;
    }

    public Expression getIterable() {
        return iterable;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(var);
        children.add(iterable);
        children.addAll(body);
        return children;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitFor(this);
    }

    @Override
    public String toString() {
        return "For{var=" + var + ", iterable=" + iterable + "}";
    }
}
