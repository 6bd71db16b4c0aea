package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.BinOp;
import me.christianrobert.retarget.translator.ast.BinaryOperator;
import me.christianrobert.retarget.translator.ast.Expression;
import me.christianrobert.retarget.translator.context.UnsupportedNodeShapeException;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.RuntimeFeature;

/**
 * Static helper for binary arithmetic and bitwise expressions.
 *
 * <p>An addition with a string constant on either side is treated as string
 * concatenation and uses the profile's concatenation spelling ({@code .}, {@code ..},
 * {@code paste0(...)}). No other type inference is attempted.</p>
 */
public class VisitBinOp {

    public static String v(BinOp node, TargetCodeBuilder b) {
        String operator = spelling(node.getOp(), node.getLeft(), node.getRight(), b.getProfile());
        usePow(node.getOp(), b);

        String left = Operands.wrapped(node.getLeft(), b);
        String right = Operands.wrapped(node.getRight(), b);
        return Operands.combine(operator, left, right);
    }

    /**
     * Records the math import some targets need for their power function.
     */
    static void usePow(BinaryOperator op, TargetCodeBuilder b) {
        if (op == BinaryOperator.POW) {
            b.getContext().useFeature(RuntimeFeature.POW);
        }
    }

    /**
     * Resolves the target spelling of an operator for the given operands.
     *
     * @throws UnsupportedNodeShapeException when the target has no form for the operator
     */
    static String spelling(BinaryOperator op, Expression left, Expression right, LanguageProfile profile) {
        if (op == BinaryOperator.ADD && (Operands.isStringConstant(left) || Operands.isStringConstant(right))) {
            return profile.getConcatOperator();
        }
        String operator = profile.binaryOperator(op);
        if (operator == null || operator.isEmpty()) {
            throw new UnsupportedNodeShapeException("Operator " + op.getAstName() + " has no form in "
                    + profile.getLanguage().getDisplayName());
        }
        return operator;
    }
}
