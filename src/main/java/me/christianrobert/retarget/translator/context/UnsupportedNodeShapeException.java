package me.christianrobert.retarget.translator.context;

/**
 * The active profile has no rule for a node or node combination.
 *
 * <p>Raised by the node helpers and contained by the code builder, which records a
 * diagnostic and substitutes the placeholder token. It never escapes an emission call.</p>
 */
public class UnsupportedNodeShapeException extends TranslationException {

    public UnsupportedNodeShapeException(String message) {
        super(message);
    }
}
