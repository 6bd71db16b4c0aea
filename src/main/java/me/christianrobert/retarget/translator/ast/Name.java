package me.christianrobert.retarget.translator.ast;

/**
 * Identifier reference.
 */
public class Name extends Expression {

    private final String id;

    public Name(String id) {
        this.id = requireName(id, "Identifier");
    }

    public String getId() {
        return id;
    }

    public boolean is(String identifier) {
        return id.equals(identifier);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitName(this);
    }

    @Override
    public String toString() {
        return "Name{" + id + "}";
    }
}
