package me.christianrobert.retarget.translator.ast;

import java.util.ArrayList;
import java.util.List;

public class While extends Statement {

    private final Expression test;
    private final List<Statement> body;

    public While(Expression test, List<Statement> body) {
        this.test = require(test, "Loop condition");
        this.body = requireList(body, "Loop body");
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(test);
        children.addAll(body);
        return children;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }

    @Override
    public String toString() {
        return "While{test=" + test + ", body=" + body.size() + "}";
    }
}
