package me.christianrobert.retarget.translator.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.retarget.config.service.ConfigService;
import me.christianrobert.retarget.translator.ast.Program;
import me.christianrobert.retarget.translator.ast.json.SourceDocument;
import me.christianrobert.retarget.translator.ast.json.SyntaxTreeReader;
import me.christianrobert.retarget.translator.builder.Placeholder;
import me.christianrobert.retarget.translator.builder.program.ProgramEmitter;
import me.christianrobert.retarget.translator.context.ConfigurationException;
import me.christianrobert.retarget.translator.context.EmissionDiagnostic;
import me.christianrobert.retarget.translator.context.EmissionResult;
import me.christianrobert.retarget.translator.context.ParseUnavailableException;
import me.christianrobert.retarget.translator.context.TranslationException;
import me.christianrobert.retarget.translator.context.TranslationResult;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.LanguageProfiles;
import me.christianrobert.retarget.translator.util.SyntaxTreeFormatter;
import me.christianrobert.retarget.translator.validation.BalanceReport;
import me.christianrobert.retarget.translator.validation.StructuralBalanceChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * High-level service for translating parsed Python programs into one of the catalog's
 * target languages. This is the entry point used by the REST resource and batch runs.
 *
 * <p>Architecture:
 * <pre>
 * JSON tree dump → SyntaxTreeReader → ProgramEmitter → post-processing → TranslationResult
 *                        ↓                  ↓                 ↓
 *                    Program         TargetCodeBuilder   imports, header, balance check
 * </pre>
 *
 * <p>Usage:
 * <pre>
 * TranslationResult result = service.translate(TranslationRequest.of("go", program));
 * if (result.isSuccess()) {
 *     String code = result.getCode();
 * } else {
 *     // Handle error: result.getErrorMessage()
 * }
 * </pre>
 *
 * <p>The service never throws for a failed translation; the outcome is always carried
 * in the returned {@link TranslationResult}.</p>
 */
@ApplicationScoped
public class TranslationService {

    private static final Logger log = LoggerFactory.getLogger(TranslationService.class);

    static final String NO_TREE_REASON = "Syntax tree unavailable";

    @Inject
    ConfigService configService;

    @Inject
    SyntaxTreeReader reader;

    @Inject
    ImportSynthesizer importSynthesizer;

    @Inject
    GeneratedHeaderWriter headerWriter;

    public TranslationResult translate(String target, Program tree) {
        return translate(TranslationRequest.of(target, tree));
    }

    /**
     * Translates one program for one target.
     *
     * <p>Handles:
     * <ul>
     *   <li>Resolving the target identifier or alias</li>
     *   <li>Emitting the original source verbatim when no tree is available</li>
     *   <li>Emission through {@link ProgramEmitter}</li>
     *   <li>Warnings for placeholders and unbalanced braces</li>
     *   <li>Import synthesis and the generated header, when enabled</li>
     * </ul>
     *
     * @param request target, tree and optional original source
     * @return TranslationResult containing either target code or error details
     */
    public TranslationResult translate(TranslationRequest request) {
        if (request == null) {
            return TranslationResult.failure(null, "Translation request cannot be null");
        }
        return translate(request.getTarget(), request.getTree(), request.getSource(),
                request.isIncludeAst(), NO_TREE_REASON);
    }

    /**
     * Translates a JSON document of the form {@code {"source": "...", "tree": {...}}}.
     *
     * <p>A missing or unreadable tree is not an error as long as the source is present:
     * the result then carries the source verbatim and is flagged as a fallback.</p>
     *
     * @param target target identifier or alias
     * @param documentJson the document
     * @param includeAst whether to include the formatted tree in the result (for debugging)
     */
    public TranslationResult translateDocument(String target, String documentJson, boolean includeAst) {
        SourceDocument document;
        try {
            document = reader.readDocument(documentJson);
        } catch (ParseUnavailableException e) {
            log.warn("Rejected translation document: {}", e.getMessage());
            return TranslationResult.failure(target, e);
        }

        Program tree = null;
        String reason = NO_TREE_REASON;
        if (document.hasTree()) {
            try {
                tree = reader.read(document.getTree());
            } catch (ParseUnavailableException e) {
                log.warn("Syntax tree could not be read: {}", e.getMessage());
                reason = NO_TREE_REASON + ": " + e.getMessage();
            }
        }
        return translate(target, tree, document.getSource(), includeAst, reason);
    }

    private TranslationResult translate(String target, Program tree, String source,
                                        boolean includeAst, String unavailableReason) {
        if (target == null || target.trim().isEmpty()) {
            return TranslationResult.failure(target, "Target language cannot be null or empty");
        }

        try {
            // STEP 1: Resolve the target profile
            log.debug("Step 1: Resolving target '{}'", target);
            LanguageProfile profile = LanguageProfiles.resolve(target);

            // STEP 2: Fall back to the original source when there is no tree
            if (tree == null) {
                if (source != null && configService.isEnabled(ConfigService.FALLBACK_VERBATIM, true)) {
                    log.warn("{} for target {}, emitting source verbatim", unavailableReason, profile.getId());
                    return TranslationResult.fallback(profile.getLanguage(), source,
                            unavailableReason + "; original source emitted verbatim");
                }
                return TranslationResult.failure(target, unavailableReason);
            }

            // STEP 3: Emit
            log.debug("Step 3: Emitting {} top-level statement(s) for {}", tree.getBody().size(), profile.getId());
            String programName = configService.getConfigValueAsString(ConfigService.WRAPPER_PROGRAM_NAME);
            if (programName == null || programName.trim().isEmpty()) {
                programName = ProgramEmitter.DEFAULT_PROGRAM_NAME;
            }
            EmissionResult emission = ProgramEmitter.emit(tree, profile.getId(), programName);
            String code = emission.getCode();

            // STEP 4: Validate
            log.debug("Step 4: Validating emitted code");
            List<String> warnings = collectWarnings(code, profile, emission);

            // STEP 5: Synthesize imports
            if (configService.isEnabled(ConfigService.IMPORTS_ENABLED, true)) {
                List<String> imports = importSynthesizer.requiredImports(profile, emission.getUsedFeatures());
                code = importSynthesizer.insertImports(code, profile, imports);
            }

            // STEP 6: Generated header
            if (configService.isEnabled(ConfigService.HEADER_ENABLED, true)) {
                String toolName = configService.getConfigValueAsString(ConfigService.HEADER_TOOL_NAME);
                code = headerWriter.prepend(code, profile, toolName);
            }

            log.info("Successfully translated program to {} ({} warning(s))", profile.getId(), warnings.size());
            log.trace("{} code: {}", profile.getId(), code);

            if (includeAst) {
                log.debug("Generating syntax tree representation");
                return TranslationResult.successWithAst(profile.getLanguage(), code, warnings,
                        emission.getDroppedImports(), SyntaxTreeFormatter.format(tree));
            }
            return TranslationResult.success(profile.getLanguage(), code, warnings, emission.getDroppedImports());

        } catch (ConfigurationException e) {
            log.warn("Translation rejected: {}", e.getMessage());
            return TranslationResult.failure(target, e);

        } catch (TranslationException e) {
            log.error("Translation failed: {}", e.getDetailedMessage(), e);
            return TranslationResult.failure(target, e);

        } catch (Exception e) {
            log.error("Unexpected error during translation", e);
            String errorMsg = "Unexpected error: " + e.getMessage();
            return TranslationResult.failure(target, errorMsg);
        }
    }

    private List<String> collectWarnings(String code, LanguageProfile profile, EmissionResult emission) {
        List<String> warnings = new ArrayList<>();
        if (code.trim().isEmpty()) {
            warnings.add("Converted code is empty");
        }

        BalanceReport balance = StructuralBalanceChecker.check(code, profile);
        if (!balance.isBalanced()) {
            log.warn("Unbalanced {} output: {}", profile.getId(), balance);
            warnings.addAll(balance.getMismatches());
        }

        int placeholders = Placeholder.count(code);
        if (placeholders > 0) {
            warnings.add(placeholders + " construct(s) could not be translated and were replaced by "
                    + Placeholder.TOKEN);
        }
        for (EmissionDiagnostic diagnostic : emission.getDiagnostics()) {
            warnings.add(diagnostic.toString());
        }
        return warnings;
    }
}
