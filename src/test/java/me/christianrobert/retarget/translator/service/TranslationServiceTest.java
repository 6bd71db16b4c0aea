package me.christianrobert.retarget.translator.service;

import me.christianrobert.retarget.config.service.ConfigService;
import me.christianrobert.retarget.translator.ast.ExprStmt;
import me.christianrobert.retarget.translator.ast.Import;
import me.christianrobert.retarget.translator.ast.OpaqueExpression;
import me.christianrobert.retarget.translator.ast.Program;
import me.christianrobert.retarget.translator.ast.json.SyntaxTreeReader;
import me.christianrobert.retarget.translator.context.TranslationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.retarget.translator.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the translation service: target resolution, post-processing and fallback.
 */
class TranslationServiceTest {

    private static final String PRINT_TREE = "{\"_type\": \"Module\", \"body\": [{\"_type\": \"Expr\","
            + " \"value\": {\"_type\": \"Call\", \"func\": {\"_type\": \"Name\", \"id\": \"print\"},"
            + " \"args\": [{\"_type\": \"Constant\", \"value\": 1}], \"keywords\": []}}]}";

    private TranslationService service;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        service = new TranslationService();
        service.configService = configService;
        service.reader = new SyntaxTreeReader();
        service.importSynthesizer = new ImportSynthesizer();
        service.headerWriter = new GeneratedHeaderWriter();
    }

    private void disablePostProcessing() {
        configService.setConfigValue(ConfigService.HEADER_ENABLED, false);
        configService.setConfigValue(ConfigService.IMPORTS_ENABLED, false);
    }

    // ==================== SUCCESS ====================

    @Test
    void translatesWithHeaderAndImports() {
        // Given
        Program program = program(print(str("hi")));

        // When
        TranslationResult result = service.translate("go", program);

        // Then
        assertTrue(result.isSuccess());
        assertEquals("go", result.getTarget());
        assertEquals(".go", result.getExtension());
        assertFalse(result.hasWarnings(), result.getWarnings().toString());
        assertTrue(result.getCode().startsWith("// ========================================\n// Tool: retarget\n"));
        assertTrue(result.getCode().endsWith(
                "package main\n\nimport \"fmt\"\n\nfunc main() {\n\tfmt.Println(\"hi\")\n}"), result.getCode());
    }

    @Test
    void postProcessingCanBeDisabled() {
        disablePostProcessing();

        TranslationResult result = service.translate("go", program(print(num(1))));

        assertEquals("package main\n\nfunc main() {\n\tfmt.Println(1)\n}", result.getCode());
    }

    @Test
    void aliasResolvesToCanonicalTarget() {
        disablePostProcessing();

        TranslationResult result = service.translate("Golang", program(print(num(1))));

        assertTrue(result.isSuccess());
        assertEquals("go", result.getTarget());
    }

    @Test
    void wrapperNameComesFromConfiguration() {
        disablePostProcessing();
        configService.setConfigValue(ConfigService.WRAPPER_PROGRAM_NAME, "Converted");

        TranslationResult result = service.translate("csharp", program(print(num(1))));

        assertTrue(result.getCode().startsWith("public class Converted {"), result.getCode());
    }

    @Test
    void toolNameComesFromConfiguration() {
        configService.setConfigValue(ConfigService.HEADER_TOOL_NAME, "py2x");

        TranslationResult result = service.translate("ruby", program(print(num(1))));

        assertTrue(result.getCode().contains("# Tool: py2x\n"), result.getCode());
    }

    @Test
    void placeholdersProduceWarnings() {
        disablePostProcessing();

        TranslationResult result = service.translate("javascript",
                program(new ExprStmt(new OpaqueExpression("Lambda"))));

        assertTrue(result.isSuccess());
        assertEquals(2, result.getWarnings().size());
        assertEquals("1 construct(s) could not be translated and were replaced by __UNTRANSLATABLE__",
                result.getWarnings().get(0));
        assertEquals("Lambda at Program/ExprStmt/Lambda: No rule for expression kind 'Lambda'",
                result.getWarnings().get(1));
    }

    @Test
    void emptyOutputProducesWarning() {
        disablePostProcessing();

        TranslationResult result = service.translate("python", program());

        assertTrue(result.isSuccess());
        assertEquals(List.of("Converted code is empty"), result.getWarnings());
    }

    @Test
    void droppedImportsAreReported() {
        disablePostProcessing();

        TranslationResult result = service.translate("lua",
                program(new Import(List.of("os")), print(num(1))));

        assertEquals(List.of("os"), result.getDroppedImports());
        assertEquals("print(1)", result.getCode().trim());
    }

    @Test
    void includesFormattedTreeOnRequest() {
        TranslationRequest request = new TranslationRequest("go", program(print(num(1))), null, true);

        TranslationResult result = service.translate(request);

        assertTrue(result.hasAstTree());
        assertTrue(result.getAstTree().startsWith("Program\n  ExprStmt\n"), result.getAstTree());
    }

    // ==================== FAILURES ====================

    @Test
    void unknownTargetFails() {
        TranslationResult result = service.translate("cobol", program(print(num(1))));

        assertTrue(result.isFailure());
        assertEquals("cobol", result.getTarget());
        assertTrue(result.getErrorMessage().startsWith("Unknown target language: 'cobol'"));
        assertNull(result.getCode());
    }

    @Test
    void blankTargetFails() {
        TranslationResult result = service.translate("  ", program());

        assertTrue(result.isFailure());
        assertEquals("Target language cannot be null or empty", result.getErrorMessage());
    }

    @Test
    void nullRequestFails() {
        assertTrue(service.translate(null).isFailure());
    }

    @Test
    void missingTreeWithoutSourceFails() {
        TranslationResult result = service.translate("go", null);

        assertTrue(result.isFailure());
        assertEquals("Syntax tree unavailable", result.getErrorMessage());
    }

    // ==================== DOCUMENTS ====================

    @Test
    void translatesDocument() {
        disablePostProcessing();

        TranslationResult result = service.translateDocument("rust",
                "{\"source\": \"print(1)\", \"tree\": " + PRINT_TREE + "}", false);

        assertTrue(result.isSuccess());
        assertFalse(result.isFallback());
        assertEquals("fn main() {\n    println!(\"{}\", 1);\n}", result.getCode());
    }

    @Test
    void missingTreeFallsBackToSource() {
        TranslationResult result = service.translateDocument("go", "{\"source\": \"print(1)\"}", false);

        assertTrue(result.isSuccess());
        assertTrue(result.isFallback());
        assertEquals("print(1)", result.getCode());
        assertEquals(List.of("Syntax tree unavailable; original source emitted verbatim"), result.getWarnings());
    }

    @Test
    void unreadableTreeFallsBackWithReason() {
        TranslationResult result = service.translateDocument("go",
                "{\"source\": \"x = 1\", \"tree\": {\"_type\": \"Expression\", \"body\": []}}", false);

        assertTrue(result.isFallback());
        assertEquals("x = 1", result.getCode());
        assertTrue(result.getWarnings().get(0).startsWith(
                "Syntax tree unavailable: Syntax tree root must be a Module, found Expression"));
    }

    @Test
    void fallbackCanBeDisabled() {
        configService.setConfigValue(ConfigService.FALLBACK_VERBATIM, false);

        TranslationResult result = service.translateDocument("go", "{\"source\": \"print(1)\"}", false);

        assertTrue(result.isFailure());
        assertEquals("Syntax tree unavailable", result.getErrorMessage());
    }

    @Test
    void fallbackStillNeedsKnownTarget() {
        TranslationResult result = service.translateDocument("cobol", "{\"source\": \"print(1)\"}", false);

        assertTrue(result.isFailure());
    }

    @Test
    void blankIdentifierInTreeFallsBackToSource() {
        // Given
        String tree = "{\"_type\": \"Module\", \"body\": [{\"_type\": \"Expr\","
                + " \"value\": {\"_type\": \"Name\", \"id\": \" \"}}]}";

        // When
        TranslationResult withSource = service.translateDocument("go",
                "{\"source\": \"x\", \"tree\": " + tree + "}", false);
        TranslationResult withoutSource = service.translateDocument("go", "{\"tree\": " + tree + "}", false);

        // Then
        assertTrue(withSource.isFallback());
        assertEquals("x", withSource.getCode());
        assertTrue(withSource.getWarnings().get(0).startsWith(
                "Syntax tree unavailable: Syntax tree is malformed: Identifier cannot be null or empty"),
                withSource.getWarnings().toString());
        assertTrue(withoutSource.isFailure());
        assertTrue(withoutSource.getErrorMessage().contains("Identifier cannot be null or empty"),
                withoutSource.getErrorMessage());
    }

    @Test
    void invalidDocumentFails() {
        TranslationResult result = service.translateDocument("go", "print(1)", false);

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().startsWith("Document is not valid JSON"), result.getErrorMessage());
    }
}
