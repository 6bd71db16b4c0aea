package me.christianrobert.retarget.translator.profile;

import me.christianrobert.retarget.translator.context.UnsupportedNodeShapeException;

import java.util.List;

/**
 * Rewrite of one origin builtin call into target text, given the already-emitted arguments.
 *
 * <p>Rules differ in structure, not just spelling: {@code len(x)} may become a call, a
 * trailing member access or a prefix operator, and {@code range(n)} may become a
 * sequence construction. The factory methods cover the shapes the catalog needs.</p>
 */
@FunctionalInterface
public interface BuiltinRule {

    /**
     * @param args emitted argument texts
     * @return target text
     * @throws UnsupportedNodeShapeException when the argument count has no rewrite
     */
    String apply(List<String> args);

    /**
     * Plain call of a target function: {@code name(a, b)}.
     */
    static BuiltinRule call(String function) {
        return args -> function + "(" + String.join(", ", args) + ")";
    }

    /**
     * Single-argument rewrite; {@code {0}} is the argument, e.g. {@code "{0}.length"}.
     */
    static BuiltinRule unary(String template) {
        return args -> {
            if (args.size() != 1) {
                throw new UnsupportedNodeShapeException("Builtin rewrite '" + template
                        + "' takes exactly one argument, got " + args.size());
            }
            return Template.fill(template, "0", args.get(0));
        };
    }

    /**
     * Arguments joined between a prefix and a suffix, e.g. a stream insertion chain.
     * Without arguments an empty string literal is inserted.
     */
    static BuiltinRule joined(String prefix, String separator, String suffix) {
        return args -> prefix + (args.isEmpty() ? "\"\"" : String.join(separator, args)) + suffix;
    }

    /**
     * Formatting call with one {@code slot} per argument in its format string, e.g.
     * {@code println!("{} {}", a, b)} or {@code printf("%s %s\n", a, b)}.
     *
     * @param lineEnd escape sequence appended to the format string, may be empty
     */
    static BuiltinRule formatMacro(String macro, String slot, String lineEnd) {
        return args -> {
            StringBuilder format = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    format.append(' ');
                }
                format.append(slot);
            }
            format.append(lineEnd);
            if (args.isEmpty()) {
                return macro + "(\"" + format + "\")";
            }
            return macro + "(\"" + format + "\", " + String.join(", ", args) + ")";
        };
    }

    /**
     * Integer range construction with one template per arity, using
     * {@code {start}}, {@code {stop}} and {@code {step}}. A one-argument range starts at 0.
     * The three-argument template must also count down for a negative step.
     */
    static BuiltinRule range(String oneArg, String twoArgs, String threeArgs) {
        return range(oneArg, twoArgs, threeArgs, threeArgs);
    }

    /**
     * Like {@link #range(String, String, String)}, with a separate template for a step that
     * is a negative literal. It may use {@code {magnitude}}, the step without its sign.
     */
    static BuiltinRule range(String oneArg, String twoArgs, String threeArgs, String descending) {
        return args -> {
            switch (args.size()) {
                case 1:
                    return Template.fill(oneArg, "start", "0", "stop", args.get(0), "step", "1");
                case 2:
                    return Template.fill(twoArgs, "start", args.get(0), "stop", args.get(1), "step", "1");
                case 3:
                    String step = args.get(2);
                    String magnitude = negativeLiteralMagnitude(step);
                    if (magnitude != null) {
                        return Template.fill(descending, "start", args.get(0), "stop", args.get(1),
                                "step", step, "magnitude", magnitude);
                    }
                    return Template.fill(threeArgs, "start", args.get(0), "stop", args.get(1), "step", step);
                default:
                    throw new UnsupportedNodeShapeException("range() takes one to three arguments, got " + args.size());
            }
        };
    }

    /**
     * For emitted text such as {@code -2} or {@code (-2)}, the digits without the sign;
     * null for anything else.
     */
    static String negativeLiteralMagnitude(String text) {
        String t = text.trim();
        if (t.startsWith("(") && t.endsWith(")")) {
            t = t.substring(1, t.length() - 1).trim();
        }
        if (!t.startsWith("-")) {
            return null;
        }
        String digits = t.substring(1).trim();
        return digits.matches("\\d+(\\.\\d+)?") ? digits : null;
    }
}
