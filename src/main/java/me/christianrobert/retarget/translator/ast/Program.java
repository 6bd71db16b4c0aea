package me.christianrobert.retarget.translator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a parsed module: the top-level statements in source order.
 */
public class Program extends SyntaxNode {

    private final List<Statement> body;

    public Program(List<Statement> body) {
        this.body = requireList(body, "Program body");
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return new ArrayList<>(body);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }

    @Override
    public String toString() {
        return "Program{statements=" + body.size() + "}";
    }
}
