package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Attribute;
import me.christianrobert.retarget.translator.ast.FunctionDef;
import me.christianrobert.retarget.translator.context.EmissionContext;
import me.christianrobert.retarget.translator.profile.BlockStyle;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.Template;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for function and method definitions.
 *
 * <h3>Template selection</h3>
 * <ul>
 *   <li>Outside a class body: function template</li>
 *   <li>{@code __init__} in a class body: constructor template</li>
 *   <li>Any other function in a class body: method template</li>
 * </ul>
 *
 * <h3>Self parameter</h3>
 * <p>The explicit leading {@code self} parameter of a method is removed. It is replaced
 * by the profile's self parameter ({@code &mut self}, {@code $self},
 * {@code self::Point}) when the profile has one, and dropped when the self reference is
 * implicit. Constructors of targets whose constructor has no receiver drop it too.</p>
 *
 * <h3>Parameters</h3>
 * <p>Parameters are declared in the new function scope, so assigning to one never emits
 * a declaration. Targets that bind parameters in the body (Perl) get a binding line
 * as the first body line.</p>
 */
public class VisitFunctionDef {

    static final String CONSTRUCTOR_NAME = "__init__";

    public static String v(FunctionDef node, TargetCodeBuilder b) {
        EmissionContext context = b.getContext();
        LanguageProfile profile = b.getProfile();
        BlockStyle style = profile.getBlockStyle();
        String indent = context.indent();

        boolean method = context.isInClassBody();
        boolean constructor = method && CONSTRUCTOR_NAME.equals(node.getName());
        String className = context.getCurrentClassName();

        // STEP 1: Parameters, explicit self removed
        List<String> params = new ArrayList<>(node.getParams());
        boolean hadSelf = method && !params.isEmpty() && Attribute.SELF.equals(params.get(0));
        if (hadSelf) {
            params.remove(0);
        }

        List<String> rendered = new ArrayList<>();
        if (hadSelf && !profile.getSelfParameter().isEmpty()
                && (!constructor || profile.isConstructorTakesSelf())) {
            rendered.add(Template.fill(profile.getSelfParameter(), "class", className));
        }
        for (String param : params) {
            rendered.add(Template.fill(profile.getParamTemplate(), "param", profile.getVariableSigil() + param));
        }
        String paramList = String.join(", ", rendered);

        // STEP 2: Header
        String template;
        if (!method) {
            template = profile.getFunctionTemplate();
        } else if (constructor) {
            template = profile.getConstructorTemplate();
        } else {
            template = profile.getMethodTemplate();
        }
        String header = Template.fill(template,
                "name", node.getName(),
                "params", paramList,
                "class", className == null ? "" : className);

        // STEP 3: Parameter binding line
        List<String> prelude = List.of();
        if (!profile.getParamBindingTemplate().isEmpty() && !rendered.isEmpty()) {
            prelude = List.of(Template.fill(profile.getParamBindingTemplate(), "params", paramList));
        }

        // STEP 4: Body in its own function scope
        String body;
        context.enterFunction();
        try {
            body = b.emitBlock(node.getBody(), true, params, prelude);
        } finally {
            context.exitFunction();
        }

        StringBuilder sb = new StringBuilder();
        sb.append(indent).append(style.open(header)).append('\n').append(body);
        String close = style.close(indent);
        if (close != null) {
            sb.append('\n').append(close);
        }
        return sb.toString();
    }
}
