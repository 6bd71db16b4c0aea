package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Constant;
import me.christianrobert.retarget.translator.ast.ExprStmt;
import me.christianrobert.retarget.translator.profile.LanguageProfile;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for expression statements.
 *
 * <p>A bare string statement is a docstring. Targets other than the origin language
 * receive it as line comments, one per docstring line, using the catalog comment token.</p>
 */
public class VisitExprStmt {

    public static String v(ExprStmt node, TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        String indent = b.getContext().indent();

        if (node.isDocstring() && !profile.isKeepDocstrings()) {
            return docstringComment((String) ((Constant) node.getExpr()).getValue(), indent, profile);
        }
        return indent + b.visit(node.getExpr()) + profile.getTerminator();
    }

    private static String docstringComment(String text, String indent, LanguageProfile profile) {
        String token = profile.getLanguage().getCommentToken();
        List<String> lines = new ArrayList<>();
        for (String line : text.strip().split("\n", -1)) {
            String trimmed = line.strip();
            lines.add(trimmed.isEmpty() ? indent + token : indent + token + " " + trimmed);
        }
        return String.join("\n", lines);
    }
}
