package me.christianrobert.retarget.translator.ast;

/**
 * Literal value: a string, a boolean, a number or the null value ({@code None}).
 */
public class Constant extends Expression {

    private final Object value;

    public Constant(Object value) {
        if (value != null && !(value instanceof String) && !(value instanceof Boolean)
                && !(value instanceof Number)) {
            throw new IllegalArgumentException("Unsupported constant type: " + value.getClass().getName());
        }
        this.value = value;
    }

    public static Constant none() {
        return new Constant(null);
    }

    public Object getValue() {
        return value;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    public boolean isNumber() {
        return value instanceof Number;
    }

    public boolean isNone() {
        return value == null;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public String toString() {
        return isString() ? "Constant{'" + value + "'}" : "Constant{" + value + "}";
    }
}
