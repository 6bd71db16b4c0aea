package me.christianrobert.retarget.translator.service;

import me.christianrobert.retarget.translator.ast.Program;

/**
 * One unit of work for {@link TranslationService}: a target plus the program tree and/or
 * the original source text it was parsed from.
 *
 * <p>The tree may be null when the upstream parser could not produce one; the source is
 * then used for the verbatim fallback.</p>
 */
public class TranslationRequest {

    private final String target;
    private final Program tree;
    private final String source;
    private final boolean includeAst;

    public TranslationRequest(String target, Program tree, String source, boolean includeAst) {
        this.target = target;
        this.tree = tree;
        this.source = source;
        this.includeAst = includeAst;
    }

    public static TranslationRequest of(String target, Program tree) {
        return new TranslationRequest(target, tree, null, false);
    }

    public String getTarget() {
        return target;
    }

    public Program getTree() {
        return tree;
    }

    public String getSource() {
        return source;
    }

    public boolean isIncludeAst() {
        return includeAst;
    }

    /**
     * Same request aimed at another target.
     */
    public TranslationRequest withTarget(String otherTarget) {
        return new TranslationRequest(otherTarget, tree, source, includeAst);
    }

    @Override
    public String toString() {
        return "TranslationRequest{target=" + target + ", hasTree=" + (tree != null)
                + ", hasSource=" + (source != null) + "}";
    }
}
