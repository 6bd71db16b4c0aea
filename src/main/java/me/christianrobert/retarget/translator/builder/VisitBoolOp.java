package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.BoolOp;
import me.christianrobert.retarget.translator.ast.BooleanOperator;
import me.christianrobert.retarget.translator.ast.Expression;
import me.christianrobert.retarget.translator.profile.LanguageProfile;

import java.util.ArrayList;
import java.util.List;

public class VisitBoolOp {

    public static String v(BoolOp node, TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        String operator = node.getOp() == BooleanOperator.AND ? profile.getAndOperator() : profile.getOrOperator();

        List<String> parts = new ArrayList<>(node.getValues().size());
        for (Expression value : node.getValues()) {
            parts.add(Operands.wrapped(value, b));
        }
        return String.join(" " + operator + " ", parts);
    }
}
