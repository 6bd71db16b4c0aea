package me.christianrobert.retarget.translator.ast;

import java.util.List;

/**
 * Expression evaluated for its effect, typically a call.
 */
public class ExprStmt extends Statement {

    private final Expression expr;

    public ExprStmt(Expression expr) {
        this.expr = require(expr, "Expression");
    }

    public Expression getExpr() {
        return expr;
    }

    /**
     * A bare string literal statement, which the origin language uses as a docstring.
     */
    public boolean isDocstring() {
        return expr instanceof Constant && ((Constant) expr).isString();
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of(expr);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitExprStmt(this);
    }

    @Override
    public String toString() {
        return "ExprStmt{" + expr + "}";
    }
}
