package me.christianrobert.retarget.translator.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * Comparison operators of {@link Compare}.
 */
public enum CompareOperator {
    EQ("Eq"),
    NOT_EQ("NotEq"),
    LT("Lt"),
    LT_E("LtE"),
    GT("Gt"),
    GT_E("GtE"),
    IS("Is"),
    IS_NOT("IsNot"),
    IN("In"),
    NOT_IN("NotIn");

    private static final Map<String, CompareOperator> BY_AST_NAME = new HashMap<>();

    static {
        for (CompareOperator op : values()) {
            BY_AST_NAME.put(op.astName, op);
        }
    }

    private final String astName;

    CompareOperator(String astName) {
        this.astName = astName;
    }

    /**
     * Name of the operator node in the origin parser's output (e.g. "Add").
     */
    public String getAstName() {
        return astName;
    }

    /**
     * Looks up an operator by its origin parser name.
     *
     * @return the operator, or null when the name is not part of the node model
     */
    public static CompareOperator fromAstName(String astName) {
        return BY_AST_NAME.get(astName);
    }
}
