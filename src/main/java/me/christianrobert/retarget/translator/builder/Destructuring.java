package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Expression;
import me.christianrobert.retarget.translator.ast.Name;
import me.christianrobert.retarget.translator.ast.TupleLit;
import me.christianrobert.retarget.translator.context.UnsupportedNodeShapeException;
import me.christianrobert.retarget.translator.profile.LanguageProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tuple targets ({@code a, b = ...}, {@code for k, v in ...}).
 */
final class Destructuring {

    private Destructuring() {
    }

    /**
     * The names a tuple target binds.
     *
     * @throws UnsupportedNodeShapeException when the template is empty or an item is not a plain name
     */
    static List<Name> names(TupleLit target, String template, LanguageProfile profile) {
        if (template.isEmpty()) {
            throw new UnsupportedNodeShapeException("Tuple unpacking has no form in "
                    + profile.getLanguage().getDisplayName());
        }
        if (target.getItems().isEmpty()) {
            throw new UnsupportedNodeShapeException("Empty tuple target");
        }
        List<Name> names = new ArrayList<>();
        for (Expression item : target.getItems()) {
            if (!(item instanceof Name)) {
                throw new UnsupportedNodeShapeException("Tuple target item " + item + " is not a plain name");
            }
            names.add((Name) item);
        }
        return names;
    }

    static String joined(List<? extends Expression> expressions, TargetCodeBuilder b) {
        return expressions.stream().map(b::visit).collect(Collectors.joining(", "));
    }

    static List<String> ids(List<Name> names) {
        return names.stream().map(Name::getId).collect(Collectors.toList());
    }
}
