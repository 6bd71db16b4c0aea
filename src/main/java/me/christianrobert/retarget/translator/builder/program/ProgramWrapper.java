package me.christianrobert.retarget.translator.builder.program;

import me.christianrobert.retarget.translator.profile.BlockStyle;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.Template;
import me.christianrobert.retarget.translator.profile.WrapperStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Packages emitted top-level statements into a whole program, per the profile's
 * {@link WrapperStrategy}.
 *
 * <p>Statements arrive already indented for the depth their strategy places them at
 * (see {@link #definitionDepth} and {@link #statementDepth}).</p>
 */
public final class ProgramWrapper {

    private ProgramWrapper() {
    }

    /**
     * Depth at which top-level definitions are emitted.
     */
    public static int definitionDepth(WrapperStrategy strategy) {
        return strategy == WrapperStrategy.SINGLE_CLASS_WITH_MAIN ? 1 : 0;
    }

    /**
     * Depth at which bare top-level statements are emitted.
     */
    public static int statementDepth(WrapperStrategy strategy) {
        switch (strategy) {
            case SINGLE_CLASS_WITH_MAIN:
                return 2;
            case PACKAGE_MAIN_FUNC:
                return 1;
            default:
                return 0;
        }
    }

    public static String wrap(LanguageProfile profile, List<EmittedStatement> statements, String programName) {
        switch (profile.getWrapperStrategy()) {
            case SINGLE_CLASS_WITH_MAIN:
                return singleClass(profile, statements, programName);
            case PACKAGE_MAIN_FUNC:
                return packageMain(profile, statements);
            case SCRIPT_TAG:
                return scriptTag(profile, statements);
            default:
                return joinAll(statements);
        }
    }

    private static String joinAll(List<EmittedStatement> statements) {
        List<String> texts = new ArrayList<>(statements.size());
        for (EmittedStatement statement : statements) {
            texts.add(statement.getText());
        }
        return String.join("\n\n", texts);
    }

    /**
     * One class holding the definitions as members and an entry point holding the bare
     * statements in source order. The entry point is emitted even when it stays empty.
     */
    private static String singleClass(LanguageProfile profile, List<EmittedStatement> statements, String programName) {
        BlockStyle style = profile.getBlockStyle();
        List<String> members = new ArrayList<>();
        List<String> mainBody = new ArrayList<>();
        for (EmittedStatement statement : statements) {
            if (statement.isDefinition()) {
                members.add(statement.getText());
            } else {
                mainBody.add(statement.getText());
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append(style.open(Template.fill(profile.getWrapperTemplate(), "program", programName))).append('\n');
        for (String member : members) {
            sb.append(member).append("\n\n");
        }
        sb.append(entryPoint(profile, mainBody, profile.indent(1))).append('\n');
        String close = style.close("");
        if (close != null) {
            sb.append(close);
        }
        return sb.toString().stripTrailing();
    }

    /**
     * Fixed prologue, top-level definitions, then a main function holding the bare
     * statements.
     */
    private static String packageMain(LanguageProfile profile, List<EmittedStatement> statements) {
        List<String> parts = new ArrayList<>();
        if (!profile.getPrologue().isEmpty()) {
            parts.add(profile.getPrologue());
        }
        List<String> mainBody = new ArrayList<>();
        for (EmittedStatement statement : statements) {
            if (statement.isDefinition()) {
                parts.add(statement.getText());
            } else {
                mainBody.add(statement.getText());
            }
        }
        parts.add(entryPoint(profile, mainBody, ""));
        if (!profile.getEpilogue().isEmpty()) {
            parts.add(profile.getEpilogue());
        }
        return String.join("\n\n", parts);
    }

    private static String scriptTag(LanguageProfile profile, List<EmittedStatement> statements) {
        StringBuilder sb = new StringBuilder(profile.getPrologue()).append('\n');
        if (!statements.isEmpty()) {
            sb.append('\n').append(joinAll(statements)).append('\n');
        }
        if (!profile.getEpilogue().isEmpty()) {
            sb.append('\n').append(profile.getEpilogue());
        }
        return sb.toString().stripTrailing();
    }

    private static String entryPoint(LanguageProfile profile, List<String> body, String indent) {
        BlockStyle style = profile.getBlockStyle();
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append(style.open(profile.getEntryPointHeader()));
        for (String line : body) {
            sb.append('\n').append(line);
        }
        String close = style.close(indent);
        if (close != null) {
            sb.append('\n').append(close);
        }
        return sb.toString();
    }
}
