package me.christianrobert.retarget.translator.ast.json;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Translation input as submitted: the original source text and the parser's tree dump.
 * Either may be missing.
 */
public class SourceDocument {

    private final String source;
    private final JsonNode tree;

    public SourceDocument(String source, JsonNode tree) {
        this.source = source;
        this.tree = tree;
    }

    public String getSource() {
        return source;
    }

    /**
     * The unconverted tree member, or null when the document has none.
     */
    public JsonNode getTree() {
        return tree;
    }

    public boolean hasTree() {
        return tree != null && !tree.isNull();
    }
}
