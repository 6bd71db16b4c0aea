package me.christianrobert.retarget.translator.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * Prefix operators of {@link UnaryOp}.
 */
public enum UnaryOperator {
    NOT("Not"),
    USUB("USub"),
    UADD("UAdd"),
    INVERT("Invert");

    private static final Map<String, UnaryOperator> BY_AST_NAME = new HashMap<>();

    static {
        for (UnaryOperator op : values()) {
            BY_AST_NAME.put(op.astName, op);
        }
    }

    private final String astName;

    UnaryOperator(String astName) {
        this.astName = astName;
    }

    /**
     * Name of the operator node in the origin parser's output (e.g. "USub").
     */
    public String getAstName() {
        return astName;
    }

    /**
     * Looks up an operator by its origin parser name.
     *
     * @return the operator, or null when the name is not part of the node model
     */
    public static UnaryOperator fromAstName(String astName) {
        return BY_AST_NAME.get(astName);
    }
}
