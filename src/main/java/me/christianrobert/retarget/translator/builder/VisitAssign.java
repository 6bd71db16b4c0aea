package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Assign;
import me.christianrobert.retarget.translator.ast.Attribute;
import me.christianrobert.retarget.translator.ast.Expression;
import me.christianrobert.retarget.translator.ast.Name;
import me.christianrobert.retarget.translator.ast.TupleLit;
import me.christianrobert.retarget.translator.context.EmissionContext;
import me.christianrobert.retarget.translator.context.UnsupportedNodeShapeException;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.Template;

import java.util.List;

/**
 * Static helper for simple assignments.
 *
 * <h3>Forms</h3>
 * <ul>
 *   <li>Name target, first sight in the visible scopes: declaration template
 *       ({@code let x = 5}, {@code x := 5}, {@code my $x = 5})</li>
 *   <li>Name target already declared: plain assignment template</li>
 *   <li>Attribute or subscript target: plain assignment template</li>
 *   <li>Name target directly inside a class body: class field template</li>
 *   <li>Tuple of names ({@code a, b = 1, 2}): destructuring declaration template when any
 *       name is new, destructuring assignment template otherwise</li>
 * </ul>
 */
public class VisitAssign {

    public static String v(Assign node, TargetCodeBuilder b) {
        EmissionContext context = b.getContext();
        LanguageProfile profile = b.getProfile();
        Expression target = node.getTarget();

        if (context.isInClassBody() && target instanceof Name) {
            String value = b.visit(node.getValue());
            return context.indent() + classField(((Name) target).getId(), value, b);
        }

        if (target instanceof TupleLit) {
            return context.indent() + destructure((TupleLit) target, node.getValue(), b) + profile.getTerminator();
        }

        String value = b.visit(node.getValue());
        String targetText = b.visit(target);

        String template = profile.getAssignmentTemplate();
        if (target instanceof Name && !((Name) target).is(Attribute.SELF)
                && context.declare(((Name) target).getId())) {
            template = profile.getDeclarationTemplate();
        }

        return context.indent()
                + Template.fill(template, "target", targetText, "value", value)
                + profile.getTerminator();
    }

    private static String destructure(TupleLit target, Expression value, TargetCodeBuilder b) {
        EmissionContext context = b.getContext();
        LanguageProfile profile = b.getProfile();

        // validated before any name is declared
        String declaration = profile.getDestructuringDeclarationTemplate();
        List<Name> names = Destructuring.names(target, declaration, profile);
        boolean fresh = false;
        for (Name name : names) {
            fresh |= context.declare(name.getId());
        }
        String template = fresh ? declaration : profile.getDestructuringAssignmentTemplate();
        if (template.isEmpty()) {
            throw new UnsupportedNodeShapeException("Tuple reassignment has no form in "
                    + profile.getLanguage().getDisplayName());
        }

        String valueText = b.visit(value);
        String values = value instanceof TupleLit
                ? Destructuring.joined(((TupleLit) value).getItems(), b)
                : valueText;
        return Template.fill(template,
                "names", Destructuring.joined(names, b), "value", valueText, "values", values);
    }

    /**
     * Class field declaration, without indentation. The template carries its own terminator.
     */
    static String classField(String name, String value, TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        return Template.fill(profile.getClassFieldTemplate(),
                "target", profile.getVariableSigil() + name,
                "value", value,
                "class", b.getContext().getCurrentClassName());
    }
}
