package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Conditional;
import me.christianrobert.retarget.translator.context.UnsupportedNodeShapeException;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.Template;

/**
 * Static helper for conditional expressions ({@code a if cond else b}).
 * Go has no expression form and reports the node as unsupported.
 */
public class VisitConditional {

    public static String v(Conditional node, TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        String template = profile.getConditionalTemplate();
        if (template.isEmpty()) {
            throw new UnsupportedNodeShapeException("Conditional expression has no form in "
                    + profile.getLanguage().getDisplayName());
        }
        return Template.fill(template,
                "test", Operands.wrapped(node.getTest(), b),
                "body", Operands.wrapped(node.getBody(), b),
                "orelse", Operands.wrapped(node.getOrelse(), b));
    }
}
