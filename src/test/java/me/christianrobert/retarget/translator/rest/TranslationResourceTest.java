package me.christianrobert.retarget.translator.rest;

import me.christianrobert.retarget.translator.context.TranslationResult;
import me.christianrobert.retarget.translator.profile.TargetLanguage;
import me.christianrobert.retarget.translator.service.BatchTranslationService;
import me.christianrobert.retarget.translator.service.TranslationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for the translation REST resource: input checks and delegation.
 */
class TranslationResourceTest {

    private static final String DOCUMENT = "{\"source\": \"print(1)\"}";

    private TranslationResource resource;
    private TranslationService translationService;
    private BatchTranslationService batchTranslationService;

    @BeforeEach
    void setUp() {
        translationService = mock(TranslationService.class);
        batchTranslationService = mock(BatchTranslationService.class);
        resource = new TranslationResource();
        resource.translationService = translationService;
        resource.batchTranslationService = batchTranslationService;
    }

    @Test
    void emptyDocumentFailsWithoutCallingService() {
        // When
        TranslationResult result = resource.translate("go", false, "   ");

        // Then
        assertTrue(result.isFailure());
        assertEquals("go", result.getTarget());
        assertEquals("Document cannot be empty", result.getErrorMessage());
        verifyNoInteractions(translationService);
    }

    @Test
    void delegatesToTranslationService() {
        // Given
        TranslationResult expected = TranslationResult.fallback(TargetLanguage.GO, "print(1)", "no tree");
        when(translationService.translateDocument("go", DOCUMENT, true)).thenReturn(expected);

        // When
        TranslationResult result = resource.translate("go", true, DOCUMENT);

        // Then
        assertSame(expected, result);
        verify(translationService).translateDocument("go", DOCUMENT, true);
    }

    @Test
    void failedTranslationIsReturnedAsIs() {
        TranslationResult failure = TranslationResult.failure("cobol", "Unknown target language: 'cobol'");
        when(translationService.translateDocument(anyString(), anyString(), anyBoolean())).thenReturn(failure);

        assertSame(failure, resource.translate("cobol", false, DOCUMENT));
    }

    @Test
    void batchRequiresTargets() {
        List<TranslationResult> results = resource.translateBatch(List.of(), false, DOCUMENT);

        assertEquals(1, results.size());
        assertTrue(results.get(0).isFailure());
        assertEquals("At least one target is required", results.get(0).getErrorMessage());
        verifyNoInteractions(batchTranslationService);
    }

    @Test
    void batchWithNullTargetsFails() {
        List<TranslationResult> results = resource.translateBatch(null, false, DOCUMENT);

        assertEquals(1, results.size());
        assertTrue(results.get(0).isFailure());
    }

    @Test
    void batchWithEmptyDocumentFailsPerTarget() {
        List<TranslationResult> results = resource.translateBatch(List.of("java", "lua"), false, "");

        assertEquals(2, results.size());
        assertEquals("java", results.get(0).getTarget());
        assertEquals("lua", results.get(1).getTarget());
        assertEquals("Document cannot be empty", results.get(1).getErrorMessage());
        verifyNoInteractions(batchTranslationService);
    }

    @Test
    void batchDelegatesToBatchService() {
        // Given
        List<String> targets = List.of("java", "lua");
        List<TranslationResult> expected = List.of(
                TranslationResult.fallback(TargetLanguage.JAVA, "print(1)", "no tree"),
                TranslationResult.fallback(TargetLanguage.LUA, "print(1)", "no tree"));
        when(batchTranslationService.translateDocument(DOCUMENT, targets, false)).thenReturn(expected);

        // When
        List<TranslationResult> results = resource.translateBatch(targets, false, DOCUMENT);

        // Then
        assertSame(expected, results);
    }

    @Test
    void listsEveryTarget() {
        // When
        List<Map<String, Object>> targets = resource.getTargets();

        // Then
        assertEquals(20, targets.size());
        assertEquals("python", targets.get(0).get("id"));

        Map<String, Object> go = targets.stream()
                .filter(t -> "go".equals(t.get("id")))
                .findFirst()
                .orElseThrow();
        assertEquals("Go", go.get("displayName"));
        assertEquals(".go", go.get("extension"));
        assertEquals(List.of("golang"), go.get("aliases"));
        assertEquals("PACKAGE_MAIN_FUNC", go.get("wrapper"));
    }
}
