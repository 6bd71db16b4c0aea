package me.christianrobert.retarget.translator.ast;

import java.util.ArrayList;
import java.util.List;

public class ListLit extends Expression {

    private final List<Expression> items;

    public ListLit(List<Expression> items) {
        this.items = requireList(items, "ListLit items");
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
        return visitor.visitListLit(this);
    }

    @Override
    public String toString() {
        return "ListLit{items=" + items.size() + "}";
    }
}
