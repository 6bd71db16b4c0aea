package me.christianrobert.retarget.translator.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * Short-circuit operators of {@link BoolOp}.
 */
public enum BooleanOperator {
    AND("And"),
    OR("Or");

    private static final Map<String, BooleanOperator> BY_AST_NAME = new HashMap<>();

    static {
        for (BooleanOperator op : values()) {
            BY_AST_NAME.put(op.astName, op);
        }
    }

    private final String astName;

    BooleanOperator(String astName) {
        this.astName = astName;
    }

    /**
     * Name of the operator node in the origin parser's output (e.g. "And").
     */
    public String getAstName() {
        return astName;
    }

    /**
     * Looks up an operator by its origin parser name.
     *
     * @return the operator, or null when the name is not part of the node model
     */
    public static BooleanOperator fromAstName(String astName) {
        return BY_AST_NAME.get(astName);
    }
}
