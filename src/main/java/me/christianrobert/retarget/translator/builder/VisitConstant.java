package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Constant;
import me.christianrobert.retarget.translator.context.UnsupportedNodeShapeException;
import me.christianrobert.retarget.translator.profile.LanguageProfile;

import java.math.BigDecimal;
import java.math.BigInteger;

public class VisitConstant {
  public static String v(Constant node, TargetCodeBuilder b) {
    LanguageProfile profile = b.getProfile();

    if (node.isNone()) {
      return profile.getNullLiteral();
    }
    if (node.isBoolean()) {
      return (Boolean) node.getValue() ? profile.getTrueLiteral() : profile.getFalseLiteral();
    }
    if (node.isString()) {
      return profile.getStringStyle().quote((String) node.getValue(), profile.getInterpolationEscapes());
    }
    return formatNumber((Number) node.getValue());
  }

  /**
   * Canonical decimal text: never exponent notation, floating values keep a fractional part.
   */
  static String formatNumber(Number number) {
    if (number instanceof Integer || number instanceof Long || number instanceof Short
        || number instanceof Byte || number instanceof BigInteger) {
      return number.toString();
    }

    BigDecimal decimal;
    if (number instanceof BigDecimal) {
      decimal = (BigDecimal) number;
    } else {
      double value = number.doubleValue();
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new UnsupportedNodeShapeException("Non-finite number " + value + " has no literal form");
      }
      decimal = BigDecimal.valueOf(value);
    }

    String text = decimal.stripTrailingZeros().toPlainString();
    if (text.indexOf('.') < 0) {
      text = text + ".0";
    }
    return text;
  }
}
