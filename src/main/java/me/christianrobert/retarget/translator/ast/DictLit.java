package me.christianrobert.retarget.translator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Dictionary display {@code {k1: v1, k2: v2}} with its pairs in source order.
 */
public class DictLit extends Expression {

    private final List<Pair> pairs;

    public DictLit(List<Pair> pairs) {
        this.pairs = requireList(pairs, "Dictionary pairs");
    }

    public List<Pair> getPairs() {
        return pairs;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        for (Pair pair : pairs) {
            children.add(pair.getKey());
            children.add(pair.getValue());
        }
        return children;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitDictLit(this);
    }

    @Override
    public String toString() {
        return "DictLit{pairs=" + pairs.size() + "}";
    }

    public static class Pair {

        private final Expression key;
        private final Expression value;

        public Pair(Expression key, Expression value) {
            this.key = require(key, "Dictionary key");
            this.value = require(value, "Dictionary value");
        }

        public Expression getKey() {
            return key;
        }

        public Expression getValue() {
            return value;
        }
    }
}
