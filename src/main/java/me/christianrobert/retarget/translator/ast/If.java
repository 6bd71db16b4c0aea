package me.christianrobert.retarget.translator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Conditional statement. An {@code elif} chain arrives as an else branch that
 * holds exactly one nested {@code If}.
 */
public class If extends Statement {

    private final Expression test;
    private final List<Statement> body;
    private final List<Statement> orelse;

    public If(Expression test, List<Statement> body, List<Statement> orelse) {
        this.test = require(test, "If condition");
        this.body = requireList(body, "If body");
        this.orelse = requireList(orelse, "If else branch");
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrelse() {
        return orelse;
    }

    public boolean hasElse() {
        return !orelse.isEmpty();
    }

    /**
     * True when the else branch is a single nested If, i.e. an {@code elif}.
     */
    public boolean hasElseIf() {
        return orelse.size() == 1 && orelse.get(0) instanceof If;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(test);
        children.addAll(body);
        children.addAll(orelse);
        return children;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public String toString() {
        return "If{test=" + test + ", body=" + body.size() + ", orelse=" + orelse.size() + "}";
    }
}
