package me.christianrobert.retarget.translator.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.retarget.translator.context.TranslationResult;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.LanguageProfiles;
import me.christianrobert.retarget.translator.profile.TargetLanguage;
import me.christianrobert.retarget.translator.service.BatchTranslationService;
import me.christianrobert.retarget.translator.service.TranslationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoint for translating parsed Python programs into the catalog's target languages.
 *
 * <p>The request body is a JSON document holding the original source and the parser's
 * tree dump. Either member may be missing; without a usable tree the source comes back
 * verbatim, flagged as a fallback.</p>
 *
 * <p>Usage:
 * <pre>
 * # Translate to Go
 * curl -X POST "http://localhost:8080/api/translation/go" \
 *   -H "Content-Type: application/json" \
 *   --data '{"source": "print(1)", "tree": {"_type": "Module", "body": [...]}}'
 *
 * # Include the formatted syntax tree in the response
 * curl -X POST "http://localhost:8080/api/translation/rust?showAst=true" \
 *   -H "Content-Type: application/json" \
 *   --data @program.json
 *
 * # Translate into several targets at once
 * curl -X POST "http://localhost:8080/api/translation/batch?targets=java&amp;targets=lua" \
 *   -H "Content-Type: application/json" \
 *   --data @program.json
 *
 * # List the supported targets
 * curl "http://localhost:8080/api/translation/targets"
 * </pre>
 *
 * <p>Response format (JSON):
 * <pre>
 * {
 *   "success": true,
 *   "target": "go",
 *   "extension": ".go",
 *   "code": "package main\n\nimport \"fmt\"\n\nfunc main() {\n\tfmt.Println(1)\n}",
 *   "warnings": [],
 *   "droppedImports": [],
 *   "fallback": false,
 *   "errorMessage": null
 * }
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" field in response.
 * A failed translation is a valid business outcome, not an HTTP error.
 */
@Path("/api/translation")
@Produces(MediaType.APPLICATION_JSON)
public class TranslationResource {

    private static final Logger log = LoggerFactory.getLogger(TranslationResource.class);

    @Inject
    TranslationService translationService;

    @Inject
    BatchTranslationService batchTranslationService;

    /**
     * Translates one document.
     *
     * @param target target identifier or alias ({@code go}, {@code c++}, {@code ps1}, ...)
     * @param showAst Optional flag to include the formatted tree in the response (for debugging)
     * @param document JSON document {@code {"source": ..., "tree": ...}}
     * @return TranslationResult as JSON (always HTTP 200, check "success" field)
     */
    @POST
    @Path("/{target}")
    @Consumes(MediaType.APPLICATION_JSON)
    public TranslationResult translate(
            @PathParam("target") String target,
            @QueryParam("showAst") @DefaultValue("false") boolean showAst,
            String document
    ) {
        log.info("Translation request received via REST API (target={})", target);
        log.trace("Document: {}", document);

        if (document == null || document.trim().isEmpty()) {
            log.warn("Empty document received");
            return TranslationResult.failure(target, "Document cannot be empty");
        }

        TranslationResult result = translationService.translateDocument(target, document, showAst);
        if (result.isSuccess()) {
            log.info("Translation to {} succeeded{}", result.getTarget(), result.isFallback() ? " (fallback)" : "");
            if (result.hasAstTree()) {
                log.debug("Syntax tree included in response");
            }
        } else {
            log.warn("Translation failed: {}", result.getErrorMessage());
        }
        return result;
    }

    /**
     * Translates one document into several targets; results follow the order of the
     * {@code targets} parameters.
     */
    @POST
    @Path("/batch")
    @Consumes(MediaType.APPLICATION_JSON)
    public List<TranslationResult> translateBatch(
            @QueryParam("targets") List<String> targets,
            @QueryParam("showAst") @DefaultValue("false") boolean showAst,
            String document
    ) {
        log.info("Batch translation request received via REST API ({} target(s))",
                targets == null ? 0 : targets.size());

        if (targets == null || targets.isEmpty()) {
            log.warn("Batch request without targets");
            return List.of(TranslationResult.failure(null, "At least one target is required"));
        }
        if (document == null || document.trim().isEmpty()) {
            log.warn("Empty document received");
            List<TranslationResult> failures = new ArrayList<>();
            for (String target : targets) {
                failures.add(TranslationResult.failure(target, "Document cannot be empty"));
            }
            return failures;
        }
        return batchTranslationService.translateDocument(document, targets, showAst);
    }

    /**
     * Lists the supported targets with their extensions and accepted aliases.
     */
    @GET
    @Path("/targets")
    public List<Map<String, Object>> getTargets() {
        List<Map<String, Object>> targets = new ArrayList<>();
        for (LanguageProfile profile : LanguageProfiles.all()) {
            TargetLanguage language = profile.getLanguage();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", language.getId());
            entry.put("displayName", language.getDisplayName());
            entry.put("extension", language.getExtension());
            entry.put("aliases", language.getAliases());
            entry.put("wrapper", profile.getWrapperStrategy().name());
            targets.add(entry);
        }
        return targets;
    }
}
