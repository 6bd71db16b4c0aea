package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.BinOp;
import me.christianrobert.retarget.translator.ast.BoolOp;
import me.christianrobert.retarget.translator.ast.Compare;
import me.christianrobert.retarget.translator.ast.Conditional;
import me.christianrobert.retarget.translator.ast.Constant;
import me.christianrobert.retarget.translator.ast.Expression;
import me.christianrobert.retarget.translator.profile.Template;

/**
 * Operand handling shared by the operator helpers.
 */
final class Operands {

    private Operands() {
    }

    /**
     * True for expressions that need parentheses when nested inside another operator.
     */
    static boolean isCompound(Expression expression) {
        return expression instanceof BinOp
                || expression instanceof BoolOp
                || expression instanceof Compare
                || expression instanceof Conditional;
    }

    /**
     * Emits an operand, parenthesized when it is itself an operator expression.
     */
    static String wrapped(Expression expression, TargetCodeBuilder b) {
        String text = b.visit(expression);
        return isCompound(expression) ? "(" + text + ")" : text;
    }

    static boolean isStringConstant(Expression expression) {
        return expression instanceof Constant && ((Constant) expression).isString();
    }

    /**
     * True when an operator spelling is a template over {@code {left}}/{@code {right}}
     * (or {@code {operand}}) instead of an infix token.
     */
    static boolean isTemplate(String operator) {
        return Template.mentions(operator, "left")
                || Template.mentions(operator, "right")
                || Template.mentions(operator, "operand");
    }

    /**
     * Applies a binary operator spelling to two emitted operands.
     */
    static String combine(String operator, String left, String right) {
        if (isTemplate(operator)) {
            return Template.fill(operator, "left", left, "right", right);
        }
        return left + " " + operator + " " + right;
    }

    /**
     * True for operators made of symbols only, which can take the {@code op=} form.
     */
    static boolean isSymbolic(String operator) {
        for (int i = 0; i < operator.length(); i++) {
            if (Character.isLetterOrDigit(operator.charAt(i)) || Character.isWhitespace(operator.charAt(i))) {
                return false;
            }
        }
        return !operator.isEmpty();
    }
}
