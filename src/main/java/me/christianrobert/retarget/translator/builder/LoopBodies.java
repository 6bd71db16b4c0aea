package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Continue;
import me.christianrobert.retarget.translator.ast.If;
import me.christianrobert.retarget.translator.ast.Statement;
import me.christianrobert.retarget.translator.profile.BlockStyle;
import me.christianrobert.retarget.translator.profile.LanguageProfile;

import java.util.List;

/**
 * Loop body framing shared by the for and while helpers.
 */
final class LoopBodies {

    private LoopBodies() {
    }

    /**
     * Emits header, body and closing line of a loop. Targets whose continue statement jumps
     * to a label get that label as the last line of any body that continues.
     */
    static String frame(String header, List<Statement> body, List<String> declared, TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        BlockStyle style = profile.getBlockStyle();
        String indent = b.getContext().indent();

        StringBuilder sb = new StringBuilder();
        sb.append(indent).append(style.open(header)).append('\n');
        sb.append(b.emitBlock(body, false, declared, List.of()));
        if (!profile.getContinueLabel().isEmpty() && continues(body)) {
            sb.append('\n').append(indent).append(profile.getIndentUnit()).append(profile.getContinueLabel());
        }
        String close = style.close(indent);
        if (close != null) {
            sb.append('\n').append(close);
        }
        return sb.toString();
    }

    /**
     * True when a continue in these statements targets the enclosing loop. Nested loops
     * and definitions own their continues.
     */
    static boolean continues(List<Statement> statements) {
        for (Statement statement : statements) {
            if (statement instanceof Continue) {
                return true;
            }
            if (statement instanceof If) {
                If branch = (If) statement;
                if (continues(branch.getBody()) || continues(branch.getOrelse())) {
                    return true;
                }
            }
        }
        return false;
    }
}
