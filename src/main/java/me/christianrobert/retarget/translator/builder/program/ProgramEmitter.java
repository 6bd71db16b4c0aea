package me.christianrobert.retarget.translator.builder.program;

import me.christianrobert.retarget.translator.ast.ClassDef;
import me.christianrobert.retarget.translator.ast.ExprStmt;
import me.christianrobert.retarget.translator.ast.FunctionDef;
import me.christianrobert.retarget.translator.ast.Import;
import me.christianrobert.retarget.translator.ast.Pass;
import me.christianrobert.retarget.translator.ast.Program;
import me.christianrobert.retarget.translator.ast.Statement;
import me.christianrobert.retarget.translator.builder.TargetCodeBuilder;
import me.christianrobert.retarget.translator.context.ConfigurationException;
import me.christianrobert.retarget.translator.context.EmissionContext;
import me.christianrobert.retarget.translator.context.EmissionResult;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.LanguageProfiles;
import me.christianrobert.retarget.translator.profile.WrapperStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the emission core: turns a whole program tree into target source text.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>Resolve the target to its profile; an unknown identifier fails immediately with
 *       {@link ConfigurationException}</li>
 *   <li>Separate top-level imports (reported as dropped) from the other statements,
 *       keeping source order</li>
 *   <li>Emit the remaining statements, each at the depth its wrapper places it</li>
 *   <li>Wrap the result per the profile's wrapper strategy</li>
 * </ol>
 *
 * <p>Every call builds its own {@link EmissionContext}; the result depends only on the
 * tree, the target and the wrapper name, and calls may run concurrently.</p>
 */
public final class ProgramEmitter {

    public static final String DEFAULT_PROGRAM_NAME = "Main";

    private ProgramEmitter() {
    }

    /**
     * Emits a program and returns only the text.
     *
     * @throws ConfigurationException when the target is not in the catalog
     */
    public static String emitProgram(Program program, String target) {
        return emit(program, target).getCode();
    }

    public static EmissionResult emit(Program program, String target) {
        return emit(program, target, DEFAULT_PROGRAM_NAME);
    }

    /**
     * Emits a program.
     *
     * @param programName name of the wrapper class for targets that need one
     * @throws ConfigurationException when the target is not in the catalog
     */
    public static EmissionResult emit(Program program, String target, String programName) {
        if (program == null) {
            throw new IllegalArgumentException("Program cannot be null");
        }
        LanguageProfile profile = LanguageProfiles.resolve(target);
        EmissionContext context = new EmissionContext(profile);
        TargetCodeBuilder builder = new TargetCodeBuilder(context);
        WrapperStrategy strategy = profile.getWrapperStrategy();

        // STEP 1: Partition imports from everything else
        List<String> droppedImports = new ArrayList<>();
        List<Statement> statements = new ArrayList<>();
        for (Statement statement : program.getBody()) {
            if (statement instanceof Import) {
                droppedImports.addAll(((Import) statement).getModules());
            } else {
                statements.add(statement);
            }
        }

        // STEP 2: Emit top-level statements
        List<EmittedStatement> emitted = new ArrayList<>();
        context.pushLocation(program.getKind());
        try {
            for (Statement statement : statements) {
                if (statement instanceof Pass && !profile.hasNoOpKeyword()) {
                    continue;
                }
                boolean definition = isDefinition(statement);
                int depth = definition
                        ? ProgramWrapper.definitionDepth(strategy)
                        : ProgramWrapper.statementDepth(strategy);
                String text = builder.visitAtDepth(statement, depth);
                if (!text.isEmpty()) {
                    emitted.add(new EmittedStatement(text, definition));
                }
            }
        } finally {
            context.popLocation();
        }

        // STEP 3: Wrap
        String code = ProgramWrapper.wrap(profile, emitted, programName);
        return new EmissionResult(code, context.getDiagnostics(), context.getUsedFeatures(), droppedImports);
    }

    // Module docstrings travel with the definitions, not into the entry point.
    private static boolean isDefinition(Statement statement) {
        return statement instanceof FunctionDef
                || statement instanceof ClassDef
                || (statement instanceof ExprStmt && ((ExprStmt) statement).isDocstring());
    }
}
