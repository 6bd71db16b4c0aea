package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Attribute;
import me.christianrobert.retarget.translator.ast.Call;
import me.christianrobert.retarget.translator.ast.Expression;
import me.christianrobert.retarget.translator.ast.Name;
import me.christianrobert.retarget.translator.profile.Builtin;
import me.christianrobert.retarget.translator.profile.BuiltinRule;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.RuntimeFeature;

import java.util.List;

/**
 * Static helper for call expressions.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>{@code print}, {@code len}, {@code str}, {@code range}: rewritten through the
 *       profile's {@link BuiltinRule}; the matching {@link RuntimeFeature} is recorded
 *       so the import synthesizer can add what the rewrite needs</li>
 *   <li>{@code self.m(...)}: callee gets the profile's self method prefix</li>
 *   <li>Plain function names are emitted without a variable sigil</li>
 *   <li>Anything else: {@code <callee>(<args>)}</li>
 * </ul>
 */
public class VisitCall {

    public static String v(Call node, TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        Expression func = node.getFunc();
        List<String> args = b.visitAll(node.getArgs());

        if (func instanceof Name) {
            String id = ((Name) func).getId();
            Builtin builtin = Builtin.fromName(id);
            if (builtin != null) {
                String rewritten = profile.builtin(builtin).apply(args);
                b.getContext().useFeature(RuntimeFeature.of(builtin));
                return rewritten;
            }
            return id + "(" + String.join(", ", args) + ")";
        }

        String callee;
        if (func instanceof Attribute && ((Attribute) func).isOnSelf()) {
            callee = profile.getSelfMethodPrefix() + ((Attribute) func).getAttr();
        } else {
            callee = b.visit(func);
        }
        return callee + "(" + String.join(", ", args) + ")";
    }
}
