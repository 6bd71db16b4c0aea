package me.christianrobert.retarget.translator.ast;

import java.util.ArrayList;
import java.util.List;

public class TupleLit extends Expression {

    private final List<Expression> items;

    public TupleLit(List<Expression> items) {
        this.items = requireList(items, "TupleLit items");
    }

    public List<Expression> getItems() {
        return items;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return new ArrayList<>(items);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitTupleLit(this);
    }

    @Override
    public String toString() {
        return "TupleLit{items=" + items.size() + "}";
    }
}
