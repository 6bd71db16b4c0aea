package me.christianrobert.retarget.translator.ast;

/**
 * Marker base for nodes that occupy a line (or block) of their own.
 */
public abstract class Statement extends SyntaxNode {
}
