package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.UnaryOp;
import me.christianrobert.retarget.translator.context.UnsupportedNodeShapeException;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.Template;

public class VisitUnaryOp {

    public static String v(UnaryOp node, TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        String operator = profile.unaryOperator(node.getOp());
        if (operator == null || operator.isEmpty()) {
            throw new UnsupportedNodeShapeException("Unary operator " + node.getOp().getAstName()
                    + " has no form in " + profile.getLanguage().getDisplayName());
        }

        String operand = Operands.wrapped(node.getOperand(), b);
        if (Operands.isTemplate(operator)) {
            return Template.fill(operator, "operand", operand);
        }
        // - -1 must not collapse into a decrement
        if (operand.startsWith("-") || operand.startsWith("+")) {
            operand = "(" + operand + ")";
        }
        return operator + operand;
    }
}
