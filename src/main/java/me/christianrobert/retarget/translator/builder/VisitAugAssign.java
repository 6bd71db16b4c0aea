package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.AugAssign;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.Template;

/**
 * Static helper for augmented assignments ({@code x += v}).
 *
 * <p>The operator is resolved with the same rules as a binary expression. The compound
 * form {@code x op= v} is used when the target supports it and the operator is a symbol;
 * otherwise the statement expands to {@code x = x op v}, or {@code x = f(x, v)} for
 * operators the profile spells as a function.</p>
 */
public class VisitAugAssign {

    public static String v(AugAssign node, TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        String operator = VisitBinOp.spelling(node.getOp(), node.getTarget(), node.getValue(), profile);
        VisitBinOp.usePow(node.getOp(), b);

        String target = b.visit(node.getTarget());
        String value = Operands.wrapped(node.getValue(), b);

        String statement;
        if (profile.isCompoundAssignment() && Operands.isSymbolic(operator)) {
            statement = target + " " + operator + "= " + value;
        } else {
            statement = Template.fill(profile.getAssignmentTemplate(),
                    "target", target,
                    "value", Operands.combine(operator, target, value));
        }
        return b.getContext().indent() + statement + profile.getTerminator();
    }
}
