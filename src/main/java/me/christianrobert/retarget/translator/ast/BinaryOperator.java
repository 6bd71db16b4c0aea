package me.christianrobert.retarget.translator.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * Arithmetic and bitwise operators of {@link BinOp} and {@link AugAssign}.
 */
public enum BinaryOperator {
    ADD("Add"),
    SUB("Sub"),
    MULT("Mult"),
    DIV("Div"),
    MOD("Mod"),
    POW("Pow"),
    FLOOR_DIV("FloorDiv"),
    MAT_MULT("MatMult"),
    LSHIFT("LShift"),
    RSHIFT("RShift"),
    BIT_OR("BitOr"),
    BIT_XOR("BitXor"),
    BIT_AND("BitAnd");

    private static final Map<String, BinaryOperator> BY_AST_NAME = new HashMap<>();

    static {
        for (BinaryOperator op : values()) {
            BY_AST_NAME.put(op.astName, op);
        }
    }

    private final String astName;

    BinaryOperator(String astName) {
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
    public static BinaryOperator fromAstName(String astName) {
        return BY_AST_NAME.get(astName);
    }
}
