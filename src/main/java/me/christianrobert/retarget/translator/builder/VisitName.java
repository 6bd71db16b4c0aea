package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Attribute;
import me.christianrobert.retarget.translator.ast.Name;
import me.christianrobert.retarget.translator.profile.LanguageProfile;

public class VisitName {
  public static String v(Name node, TargetCodeBuilder b) {
    LanguageProfile profile = b.getProfile();
    String id = node.getId();

    switch (id) {
      case Attribute.SELF:
        return profile.getSelfReference();
      case "True":
        return profile.getTrueLiteral();
      case "False":
        return profile.getFalseLiteral();
      case "None":
        return profile.getNullLiteral();
      default:
        return profile.getVariableSigil() + id;
    }
  }
}
