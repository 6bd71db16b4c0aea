package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Attribute;
import me.christianrobert.retarget.translator.profile.LanguageProfile;

public class VisitAttribute {
  public static String v(Attribute node, TargetCodeBuilder b) {
    LanguageProfile profile = b.getProfile();

    // self.x is a field access: this.x, $this->x, @x, $self->{x}, ...
    if (node.isOnSelf()) {
      return profile.getSelfFieldPrefix() + node.getAttr() + profile.getSelfFieldSuffix();
    }

    return Operands.wrapped(node.getValue(), b) + profile.getMemberAccess() + node.getAttr();
  }
}
