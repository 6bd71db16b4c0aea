package me.christianrobert.retarget.translator.util;

import me.christianrobert.retarget.translator.ast.Attribute;
import me.christianrobert.retarget.translator.ast.AugAssign;
import me.christianrobert.retarget.translator.ast.BinOp;
import me.christianrobert.retarget.translator.ast.BoolOp;
import me.christianrobert.retarget.translator.ast.ClassDef;
import me.christianrobert.retarget.translator.ast.Compare;
import me.christianrobert.retarget.translator.ast.CompareOperator;
import me.christianrobert.retarget.translator.ast.Constant;
import me.christianrobert.retarget.translator.ast.FunctionDef;
import me.christianrobert.retarget.translator.ast.Import;
import me.christianrobert.retarget.translator.ast.Name;
import me.christianrobert.retarget.translator.ast.SyntaxNode;
import me.christianrobert.retarget.translator.ast.UnaryOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats syntax trees into human-readable, indented text representation.
 *
 * <p>Useful for debugging what the tree reader produced from a parser dump.</p>
 *
 * <p>Example output:</p>
 * <pre>
 * Program
 *   FunctionDef [greet(name)]
 *     ExprStmt
 *       Call
 *         Name [print]
 *         Name [name]
 * </pre>
 */
public class SyntaxTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a tree into human-readable text.
   *
   * @param tree Root of the tree
   * @return Formatted string representation
   */
  public static String format(SyntaxNode tree) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(tree, 0, sb);
    return sb.toString();
  }

  private static void formatNode(SyntaxNode node, int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }

    sb.append(node.getKind());
    String detail = detail(node);
    if (detail != null) {
      sb.append(" [").append(escapeAndTruncate(detail)).append("]");
    }
    sb.append("\n");

    for (SyntaxNode child : node.getChildren()) {
      formatNode(child, depth + 1, sb);
    }
  }

  /**
   * Short identifying text for leaf-like and named nodes, or null.
   */
  private static String detail(SyntaxNode node) {
    if (node instanceof FunctionDef) {
      FunctionDef function = (FunctionDef) node;
      return function.getName() + "(" + String.join(", ", function.getParams()) + ")";
    }
    if (node instanceof ClassDef) {
      return ((ClassDef) node).getName();
    }
    if (node instanceof Name) {
      return ((Name) node).getId();
    }
    if (node instanceof Constant) {
      Constant constant = (Constant) node;
      if (constant.isNone()) {
        return "None";
      }
      return constant.isString() ? "\"" + constant.getValue() + "\"" : String.valueOf(constant.getValue());
    }
    if (node instanceof Attribute) {
      return "." + ((Attribute) node).getAttr();
    }
    if (node instanceof BinOp) {
      return ((BinOp) node).getOp().getAstName();
    }
    if (node instanceof AugAssign) {
      return ((AugAssign) node).getOp().getAstName();
    }
    if (node instanceof UnaryOp) {
      return ((UnaryOp) node).getOp().getAstName();
    }
    if (node instanceof BoolOp) {
      return ((BoolOp) node).getOp().getAstName();
    }
    if (node instanceof Compare) {
      List<String> ops = new ArrayList<>();
      for (CompareOperator op : ((Compare) node).getOps()) {
        ops.add(op.getAstName());
      }
      return String.join(", ", ops);
    }
    if (node instanceof Import) {
      return String.join(", ", ((Import) node).getModules());
    }
    return null;
  }

  private static String escapeAndTruncate(String text) {
    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }
    return text;
  }
}
