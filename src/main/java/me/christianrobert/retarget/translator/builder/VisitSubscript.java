package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Subscript;
import me.christianrobert.retarget.translator.profile.Template;

public class VisitSubscript {
  public static String v(Subscript node, TargetCodeBuilder b) {
    String value = Operands.wrapped(node.getValue(), b);
    String index = b.visit(node.getIndex());
    return Template.fill(b.getProfile().getSubscriptTemplate(), "value", value, "index", index);
  }
}
