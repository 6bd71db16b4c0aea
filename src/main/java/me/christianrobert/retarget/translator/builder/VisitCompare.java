package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.BinOp;
import me.christianrobert.retarget.translator.ast.Compare;
import me.christianrobert.retarget.translator.ast.CompareOperator;
import me.christianrobert.retarget.translator.ast.Expression;
import me.christianrobert.retarget.translator.context.UnsupportedNodeShapeException;
import me.christianrobert.retarget.translator.profile.LanguageProfile;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for comparisons, including chains such as {@code a < b < c}.
 *
 * <p>When every operator of the chain is an infix token, the chain is emitted as is:
 * {@code <left> <op> <operand> <op> <operand>}. When an operator is a template
 * (e.g. membership as {@code {right}.includes({left})}), the chain is split into
 * pairwise comparisons joined with the profile's logical and.</p>
 */
public class VisitCompare {

    public static String v(Compare node, TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        List<CompareOperator> ops = node.getOps();
        List<Expression> comparators = node.getComparators();

        // STEP 1: Resolve every operator before emitting operands
        List<String> spellings = new ArrayList<>(ops.size());
        boolean anyTemplate = false;
        for (CompareOperator op : ops) {
            String spelling = profile.compareOperator(op);
            if (spelling == null || spelling.isEmpty()) {
                throw new UnsupportedNodeShapeException("Comparison " + op.getAstName() + " has no form in "
                        + profile.getLanguage().getDisplayName());
            }
            anyTemplate |= Operands.isTemplate(spelling);
            spellings.add(spelling);
        }

        // STEP 2: Infix chain
        if (!anyTemplate) {
            StringBuilder sb = new StringBuilder(chainOperand(node.getLeft(), b));
            for (int i = 0; i < spellings.size(); i++) {
                sb.append(' ').append(spellings.get(i)).append(' ').append(chainOperand(comparators.get(i), b));
            }
            return sb.toString();
        }

        // STEP 3: Pairwise comparisons
        List<String> operands = new ArrayList<>(comparators.size() + 1);
        operands.add(Operands.wrapped(node.getLeft(), b));
        for (Expression comparator : comparators) {
            operands.add(Operands.wrapped(comparator, b));
        }
        List<String> pairs = new ArrayList<>(spellings.size());
        for (int i = 0; i < spellings.size(); i++) {
            String pair = Operands.combine(spellings.get(i), operands.get(i), operands.get(i + 1));
            pairs.add(spellings.size() > 1 ? "(" + pair + ")" : pair);
        }
        return String.join(" " + profile.getAndOperator() + " ", pairs);
    }

    // arithmetic operands stay bare in an infix chain
    private static String chainOperand(Expression operand, TargetCodeBuilder b) {
        String text = b.visit(operand);
        if (Operands.isCompound(operand) && !(operand instanceof BinOp)) {
            return "(" + text + ")";
        }
        return text;
    }
}
