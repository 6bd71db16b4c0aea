package me.christianrobert.retarget.translator.ast;

import java.util.List;

/**
 * Base of the closed node model consumed by the emitters.
 *
 * <p>Nodes are immutable: every constructor validates its arguments and copies
 * child lists into unmodifiable lists. A tree is built once by its producer
 * (usually {@link me.christianrobert.retarget.translator.ast.json.SyntaxTreeReader})
 * and is never mutated during emission.</p>
 */
public abstract class SyntaxNode {

    public abstract <R> R accept(SyntaxVisitor<R> visitor);

    /**
     * Node kind as named by the origin parser (e.g. "FunctionDef", "BinOp").
     */
    public String getKind() {
        return getClass().getSimpleName();
    }

    /**
     * Direct children in source order, used by tree formatting and traversal checks.
     */
    public List<SyntaxNode> getChildren() {
        return List.of();
    }

    protected static <T> T require(T value, String what) {
        if (value == null) {
            throw new IllegalArgumentException(what + " cannot be null");
        }
        return value;
    }

    protected static String requireName(String value, String what) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(what + " cannot be null or empty");
        }
        return value;
    }

    protected static <T> List<T> requireList(List<T> values, String what) {
        if (values == null) {
            throw new IllegalArgumentException(what + " cannot be null");
        }
        // List.copyOf rejects null elements
        return List.copyOf(values);
    }
}
