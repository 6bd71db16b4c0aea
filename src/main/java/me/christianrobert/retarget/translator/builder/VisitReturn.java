package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Return;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.Template;

public class VisitReturn {
  public static String v(Return node, TargetCodeBuilder b) {
    LanguageProfile profile = b.getProfile();
    String indent = b.getContext().indent();

    if (!node.hasValue()) {
      return indent + profile.getBareReturn() + profile.getTerminator();
    }
    String value = b.visit(node.getValue());
    return indent + Template.fill(profile.getReturnTemplate(), "value", value) + profile.getTerminator();
  }
}
