package me.christianrobert.retarget.translator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Call with positional arguments.
 */
public class Call extends Expression {

    private final Expression func;
    private final List<Expression> args;

    public Call(Expression func, List<Expression> args) {
        this.func = require(func, "Callee");
        this.args = requireList(args, "Call arguments");
    }

    public Expression getFunc() {
        return func;
    }

    public List<Expression> getArgs() {
        return args;
    }

    /**
     * True when the callee is a plain name equal to {@code name}.
     */
    public boolean calls(String name) {
        return func instanceof Name && ((Name) func).is(name);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(func);
        children.addAll(args);
        return children;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String toString() {
        return "Call{func=" + func + ", args=" + args.size() + "}";
    }
}
