package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Assign;
import me.christianrobert.retarget.translator.ast.ClassDef;
import me.christianrobert.retarget.translator.ast.ExprStmt;
import me.christianrobert.retarget.translator.ast.Expression;
import me.christianrobert.retarget.translator.ast.FunctionDef;
import me.christianrobert.retarget.translator.ast.Name;
import me.christianrobert.retarget.translator.ast.Pass;
import me.christianrobert.retarget.translator.ast.Statement;
import me.christianrobert.retarget.translator.context.EmissionContext;
import me.christianrobert.retarget.translator.profile.BlockStyle;
import me.christianrobert.retarget.translator.profile.ClassLayout;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.Template;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for class definitions.
 *
 * <h3>Nested layout</h3>
 * <p>Targets with classes emit one block: header with inheritance clause, optional body
 * preamble ({@code public:}), fields and methods, and an optional terminator after the
 * closing line ({@code };}).</p>
 *
 * <h3>Detached layout</h3>
 * <p>Targets without classes (C, Go, Rust, Lua, R, Julia) emit a struct-like declaration
 * holding the fields, followed by the methods as receiver or prefixed functions, wrapped
 * in an impl block where the profile has one. No inheritance clause is emitted.</p>
 * <pre>
 * type Point struct {                      struct Point {
 *     x interface{}                            x: i64,
 * }                                        }
 *
 * func (self *Point) norm() {              impl Point {
 *     ...                                      fn norm(&amp;mut self) {
 * }                                                ...
 *                                              }
 *                                          }
 * </pre>
 */
public class VisitClassDef {

    public static String v(ClassDef node, TargetCodeBuilder b) {
        if (b.getProfile().getClassLayout() == ClassLayout.DETACHED) {
            return detached(node, b);
        }
        return nested(node, b);
    }

    private static String nested(ClassDef node, TargetCodeBuilder b) {
        EmissionContext context = b.getContext();
        LanguageProfile profile = b.getProfile();
        BlockStyle style = profile.getBlockStyle();
        String indent = context.indent();

        String header = Template.fill(profile.getClassTemplate(), "name", node.getName())
                + inheritanceClause(node, b);

        List<String> prelude = profile.getClassBodyPreamble().isEmpty()
                ? List.of()
                : List.of(profile.getClassBodyPreamble());

        String body;
        context.enterClass(node.getName());
        try {
            body = b.emitBlock(node.getBody(), true, List.of(), prelude);
        } finally {
            context.exitClass();
        }

        StringBuilder sb = new StringBuilder();
        sb.append(indent).append(style.open(header)).append('\n').append(body);
        String close = style.close(indent);
        if (close != null) {
            sb.append('\n').append(close).append(profile.getClassTerminator());
        }
        return sb.toString();
    }

    private static String detached(ClassDef node, TargetCodeBuilder b) {
        EmissionContext context = b.getContext();
        LanguageProfile profile = b.getProfile();
        BlockStyle style = profile.getBlockStyle();
        String indent = context.indent();
        String name = node.getName();

        // STEP 1: Split the body
        List<Assign> fields = new ArrayList<>();
        List<FunctionDef> methods = new ArrayList<>();
        List<Statement> others = new ArrayList<>();
        for (Statement statement : node.getBody()) {
            if (statement instanceof Assign && ((Assign) statement).getTarget() instanceof Name) {
                fields.add((Assign) statement);
            } else if (statement instanceof FunctionDef) {
                methods.add((FunctionDef) statement);
            } else if (!(statement instanceof Pass)) {
                others.add(statement);
            }
        }

        List<String> parts = new ArrayList<>();
        context.enterClass(name);
        try {
            // STEP 2: Docstrings as comments above the declaration, anything else is unsupported
            List<String> leading = new ArrayList<>();
            for (Statement other : others) {
                if (other instanceof ExprStmt && ((ExprStmt) other).isDocstring()) {
                    leading.add(b.visit(other));
                } else {
                    context.report(other.getKind(), "Statement in a class body has no form in "
                            + profile.getLanguage().getDisplayName());
                    leading.add(indent + Placeholder.TOKEN);
                }
            }

            // STEP 3: Struct declaration with the fields
            List<String> declaration = new ArrayList<>(leading);
            String header = Template.fill(profile.getClassTemplate(), "name", name, "class", name);
            boolean emptyClass = fields.isEmpty() && methods.isEmpty();
            if (profile.isStructBlock()) {
                declaration.add(indent + style.open(header));
                context.enterBlock(true);
                try {
                    for (Assign field : fields) {
                        declaration.add(context.indent() + fieldLine(field, b));
                    }
                    if (emptyClass) {
                        declaration.add(context.indent() + profile.noOpStatement());
                    }
                } finally {
                    context.exitBlock();
                }
                String close = style.close(indent);
                if (close != null) {
                    declaration.add(close + profile.getClassTerminator());
                }
            } else {
                declaration.add(indent + header);
                for (Assign field : fields) {
                    declaration.add(indent + fieldLine(field, b));
                }
            }
            parts.add(String.join("\n", declaration));

            // STEP 4: Methods, in an impl block or as free functions
            if (!methods.isEmpty()) {
                if (profile.getImplTemplate().isEmpty()) {
                    for (FunctionDef method : methods) {
                        parts.add(b.visit(method));
                    }
                } else {
                    parts.add(implBlock(methods, name, b));
                }
            }
        } finally {
            context.exitClass();
        }
        return String.join("\n\n", parts);
    }

    private static String fieldLine(Assign field, TargetCodeBuilder b) {
        String fieldName = ((Name) field.getTarget()).getId();
        return VisitAssign.classField(fieldName, b.visit(field.getValue()), b);
    }

    private static String implBlock(List<FunctionDef> methods, String className, TargetCodeBuilder b) {
        EmissionContext context = b.getContext();
        LanguageProfile profile = b.getProfile();
        BlockStyle style = profile.getBlockStyle();
        String indent = context.indent();

        List<String> lines = new ArrayList<>();
        lines.add(indent + style.open(Template.fill(profile.getImplTemplate(), "class", className)));
        context.enterBlock(true);
        try {
            for (FunctionDef method : methods) {
                lines.add(b.visit(method));
            }
        } finally {
            context.exitBlock();
        }
        String close = style.close(indent);
        if (close != null) {
            lines.add(close);
        }
        return String.join("\n", lines);
    }

    /**
     * Inheritance clause for the nested layout, or an empty string.
     * The implicit {@code object} base is skipped. Single-inheritance targets keep the
     * first base and record a diagnostic for the rest.
     */
    static String inheritanceClause(ClassDef node, TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        if (profile.getBaseClauseTemplate().isEmpty()) {
            return "";
        }

        List<String> bases = new ArrayList<>();
        for (Expression base : node.getBases()) {
            if (base instanceof Name && ((Name) base).is("object")) {
                continue;
            }
            String baseName = base instanceof Name ? ((Name) base).getId() : b.visit(base);
            bases.add(Template.fill(profile.getBaseItemTemplate(), "base", baseName));
        }
        if (bases.isEmpty()) {
            return "";
        }
        if (profile.isSingleInheritance() && bases.size() > 1) {
            b.getContext().report(node.getKind(), "Only the first of " + bases.size()
                    + " base classes is kept; " + profile.getLanguage().getDisplayName()
                    + " has single inheritance");
            bases = bases.subList(0, 1);
        }
        return Template.fill(profile.getBaseClauseTemplate(), "bases", String.join(", ", bases));
    }
}
