package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Call;
import me.christianrobert.retarget.translator.ast.Constant;
import me.christianrobert.retarget.translator.ast.Expression;
import me.christianrobert.retarget.translator.ast.For;
import me.christianrobert.retarget.translator.ast.Name;
import me.christianrobert.retarget.translator.ast.TupleLit;
import me.christianrobert.retarget.translator.ast.UnaryOp;
import me.christianrobert.retarget.translator.ast.UnaryOperator;
import me.christianrobert.retarget.translator.context.UnsupportedNodeShapeException;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.Template;

import java.util.List;

/**
 * Static helper for for loops.
 *
 * <h3>Strategy</h3>
 * <ol>
 *   <li>{@code for i in range(...)} with a plain loop variable and a literal step, on a
 *       target with a counted loop template: emitted as a counted loop
 *       ({@code for (let i = 0; i < n; i += 1)}). A negative step uses the descending
 *       template ({@code i > stop})</li>
 *   <li>Otherwise the target's value iteration idiom over the emitted iterable, so
 *       {@code range(...)} is rewritten by the builtin rule
 *       ({@code (0...n).each do |i|}, {@code foreach ($i in 0..(n - 1))})</li>
 *   <li>A tuple loop variable ({@code for k, v in pairs}) uses the destructuring loop
 *       template</li>
 *   <li>A target without the needed iteration form (C) reports the loop as unsupported</li>
 * </ol>
 *
 * <p>Every loop variable is declared in the loop's own scope.</p>
 */
public class VisitFor {

    public static String v(For node, TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        Expression var = node.getVar();

        String header;
        List<String> declared;
        if (var instanceof TupleLit) {
            List<Name> names = Destructuring.names((TupleLit) var, profile.getDestructuringForTemplate(), profile);
            header = Template.fill(profile.getDestructuringForTemplate(),
                    "names", Destructuring.joined(names, b), "iter", b.visit(node.getIterable()));
            declared = Destructuring.ids(names);
        } else {
            header = header(node, b);
            declared = var instanceof Name ? List.of(((Name) var).getId()) : List.of();
        }
        return LoopBodies.frame(header, node.getBody(), declared, b);
    }

    private static String header(For node, TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        String counted = countedTemplate(node, profile);
        if (counted != null) {
            List<String> args = b.visitAll(((Call) node.getIterable()).getArgs());
            String start = args.size() == 1 ? "0" : args.get(0);
            String stop = args.size() == 1 ? args.get(0) : args.get(1);
            String step = args.size() == 3 ? args.get(2) : "1";
            return Template.fill(counted,
                    "var", b.visit(node.getVar()), "start", start, "stop", stop, "step", step);
        }
        if (profile.getForTemplate().isEmpty()) {
            throw new UnsupportedNodeShapeException("Value iteration has no form in "
                    + profile.getLanguage().getDisplayName());
        }
        return Template.fill(profile.getForTemplate(),
                "var", b.visit(node.getVar()), "iter", b.visit(node.getIterable()));
    }

    /**
     * Counted loop template for a {@code range} loop, or null when the loop iterates values.
     * A step whose sign is not known from the tree never counts.
     */
    static String countedTemplate(For node, LanguageProfile profile) {
        if (!(node.getVar() instanceof Name) || !(node.getIterable() instanceof Call)) {
            return null;
        }
        Call call = (Call) node.getIterable();
        int arity = call.getArgs().size();
        if (!call.calls("range") || arity < 1 || arity > 3) {
            return null;
        }
        int sign = arity == 3 ? stepSign(call.getArgs().get(2)) : 1;
        String template;
        if (sign > 0) {
            template = profile.getCountedForTemplate();
        } else if (sign < 0) {
            template = profile.getCountedForDownTemplate();
        } else {
            return null;
        }
        return template.isEmpty() ? null : template;
    }

    /**
     * Sign of a literal step: 1, -1, or 0 when the step is zero or not a literal.
     */
    static int stepSign(Expression step) {
        int factor = 1;
        Expression literal = step;
        if (step instanceof UnaryOp) {
            UnaryOp unary = (UnaryOp) step;
            if (unary.getOp() == UnaryOperator.USUB) {
                factor = -1;
            } else if (unary.getOp() != UnaryOperator.UADD) {
                return 0;
            }
            literal = unary.getOperand();
        }
        if (!(literal instanceof Constant) || !((Constant) literal).isNumber()) {
            return 0;
        }
        double value = ((Number) ((Constant) literal).getValue()).doubleValue();
        return factor * (int) Math.signum(value);
    }
}
