package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.If;
import me.christianrobert.retarget.translator.profile.BlockStyle;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.Template;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for if statements.
 *
 * <p>An else branch holding exactly one nested if is flattened into an else-if link,
 * repeatedly, so {@code if/elif/elif/else} becomes one chain in every block style:</p>
 * <pre>
 * if (a) {          if a:          if a
 *     ...               ...            ...
 * } else if (b) {   elif b:        elsif b
 *     ...               ...            ...
 * } else {          else:          else
 *     ...               ...            ...
 * }                                end
 * </pre>
 */
public class VisitIf {

    public static String v(If node, TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        BlockStyle style = profile.getBlockStyle();
        String indent = b.getContext().indent();
        List<String> lines = new ArrayList<>();

        // STEP 1: if branch
        String test = b.visit(node.getTest());
        lines.add(indent + style.open(Template.fill(profile.getIfTemplate(), "test", test)));
        lines.add(b.emitBlock(node.getBody(), false));

        // STEP 2: else-if links
        If current = node;
        while (current.hasElseIf()) {
            If elseIf = (If) current.getOrelse().get(0);
            String elseIfTest = b.visit(elseIf.getTest());
            lines.add(style.continuation(indent, Template.fill(profile.getElseIfTemplate(), "test", elseIfTest)));
            lines.add(b.emitBlock(elseIf.getBody(), false));
            current = elseIf;
        }

        // STEP 3: final else
        if (current.hasElse()) {
            lines.add(style.continuation(indent, profile.getElseKeyword()));
            lines.add(b.emitBlock(current.getOrelse(), false));
        }

        String close = style.close(indent);
        if (close != null) {
            lines.add(close);
        }
        return String.join("\n", lines);
    }
}
