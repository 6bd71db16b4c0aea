package me.christianrobert.retarget.translator.ast;

import java.util.List;

/**
 * Member access {@code value.attr}.
 */
public class Attribute extends Expression {

    /** The origin language's instance-reference name. */
    public static final String SELF = "self";

    private final Expression value;
    private final String attr;

    public Attribute(Expression value, String attr) {
        this.value = require(value, "Attribute owner");
        this.attr = requireName(attr, "Attribute name");
    }

    public Expression getValue() {
        return value;
    }

    public String getAttr() {
        return attr;
    }

    /**
     * True when the owner is the plain name {@code self}.
     */
    public boolean isOnSelf() {
        return value instanceof Name && ((Name) value).is(SELF);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of(value);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }

    @Override
    public String toString() {
        return "Attribute{" + value + "." + attr + "}";
    }
}
