package me.christianrobert.retarget.translator.ast;

/**
 * Marker base for nodes that produce a value and are emitted inline.
 */
public abstract class Expression extends SyntaxNode {
}
