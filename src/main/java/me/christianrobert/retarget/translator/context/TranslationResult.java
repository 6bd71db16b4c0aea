package me.christianrobert.retarget.translator.context;

import me.christianrobert.retarget.translator.profile.TargetLanguage;

import java.util.List;

/**
 * Result of a translation request.
 * Contains either the generated target source or an error message.
 * Optionally includes the formatted syntax tree for debugging.
 */
public class TranslationResult {

    private final boolean success;
    private final String target;
    private final String extension;
    private final String code;
    private final List<String> warnings;
    private final List<String> droppedImports;
    private final boolean fallback;
    private final String errorMessage;
    private final String astTree;  // Optional tree representation (null by default)

    private TranslationResult(boolean success, String target, String extension, String code,
                              List<String> warnings, List<String> droppedImports, boolean fallback,
                              String errorMessage, String astTree) {
        this.success = success;
        this.target = target;
        this.extension = extension;
        this.code = code;
        this.warnings = List.copyOf(warnings);
        this.droppedImports = List.copyOf(droppedImports);
        this.fallback = fallback;
        this.errorMessage = errorMessage;
        this.astTree = astTree;
    }

    /**
     * Creates a successful translation result.
     */
    public static TranslationResult success(TargetLanguage language, String code,
                                            List<String> warnings, List<String> droppedImports) {
        return new TranslationResult(true, language.getId(), language.getExtension(), code,
                warnings, droppedImports, false, null, null);
    }

    /**
     * Creates a successful translation result with the formatted syntax tree.
     */
    public static TranslationResult successWithAst(TargetLanguage language, String code,
                                                   List<String> warnings, List<String> droppedImports,
                                                   String astTree) {
        return new TranslationResult(true, language.getId(), language.getExtension(), code,
                warnings, droppedImports, false, null, astTree);
    }

    /**
     * Creates a result carrying the original source unchanged, used when no syntax tree
     * was available.
     */
    public static TranslationResult fallback(TargetLanguage language, String originalSource, String reason) {
        return new TranslationResult(true, language.getId(), language.getExtension(), originalSource,
                List.of(reason), List.of(), true, null, null);
    }

    /**
     * Creates a failed translation result.
     */
    public static TranslationResult failure(String target, String errorMessage) {
        return new TranslationResult(false, target, null, null, List.of(), List.of(), false, errorMessage, null);
    }

    /**
     * Creates a failed translation result from an exception.
     */
    public static TranslationResult failure(String target, TranslationException exception) {
        return failure(target, exception.getDetailedMessage());
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getTarget() {
        return target;
    }

    public String getExtension() {
        return extension;
    }

    public String getCode() {
        return code;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<String> getDroppedImports() {
        return droppedImports;
    }

    /**
     * True when the code is the original source, emitted verbatim.
     */
    public boolean isFallback() {
        return fallback;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getAstTree() {
        return astTree;
    }

    public boolean hasAstTree() {
        return astTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "TranslationResult{success=true, target=" + target
                    + (fallback ? ", fallback=true" : "")
                    + ", warnings=" + warnings.size()
                    + (astTree != null ? ", hasAstTree=true" : "") + "}";
        } else {
            return "TranslationResult{success=false, target=" + target + ", error='" + errorMessage + "'}";
        }
    }
}
