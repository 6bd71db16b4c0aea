package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.While;
import me.christianrobert.retarget.translator.profile.Template;

import java.util.List;

public class VisitWhile {

    public static String v(While node, TargetCodeBuilder b) {
        String header = Template.fill(b.getProfile().getWhileTemplate(), "test", b.visit(node.getTest()));
        return LoopBodies.frame(header, node.getBody(), List.of(), b);
    }
}
