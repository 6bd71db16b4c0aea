package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.DictLit;
import me.christianrobert.retarget.translator.ast.ListLit;
import me.christianrobert.retarget.translator.ast.TupleLit;
import me.christianrobert.retarget.translator.profile.RuntimeFeature;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for list, tuple and dictionary displays.
 */
public class VisitContainerLiteral {

    public static String list(ListLit node, TargetCodeBuilder b) {
        List<String> items = b.visitAll(node.getItems());
        String text = b.getProfile().getListSyntax().render(items, "list");
        b.getContext().useFeature(RuntimeFeature.LIST);
        return text;
    }

    public static String tuple(TupleLit node, TargetCodeBuilder b) {
        List<String> items = b.visitAll(node.getItems());
        String text = b.getProfile().getTupleSyntax().render(items, "tuple");
        b.getContext().useFeature(RuntimeFeature.TUPLE);
        return text;
    }

    public static String dict(DictLit node, TargetCodeBuilder b) {
        List<String[]> pairs = new ArrayList<>(node.getPairs().size());
        for (DictLit.Pair pair : node.getPairs()) {
            pairs.add(new String[]{b.visit(pair.getKey()), b.visit(pair.getValue())});
        }
        String text = b.getProfile().getDictSyntax().render(pairs);
        b.getContext().useFeature(RuntimeFeature.DICT);
        return text;
    }
}
