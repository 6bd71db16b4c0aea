package me.christianrobert.retarget.translator.context;

import me.christianrobert.retarget.translator.profile.LanguageProfiles;
import me.christianrobert.retarget.translator.profile.RuntimeFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmissionContextTest {

    private EmissionContext context;

    @BeforeEach
    void setUp() {
        context = new EmissionContext(LanguageProfiles.resolve("go"));
    }

    @Test
    void rejectsNullProfile() {
        assertThrows(IllegalArgumentException.class, () -> new EmissionContext(null));
    }

    @Test
    void blocksChangeDepthAndIndent() {
        assertEquals("", context.indent());

        context.enterBlock(false);
        context.enterBlock(false);
        assertEquals(2, context.getDepth());
        assertEquals("\t\t", context.indent());

        context.exitBlock();
        assertEquals(1, context.getDepth());
    }

    @Test
    void negativeDepthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> context.setDepth(-1));
    }

    @Test
    void classBodyTracking() {
        assertFalse(context.isInClassBody());
        assertNull(context.getCurrentClassName());

        context.enterClass("Point");
        assertTrue(context.isInClassBody());
        assertEquals("Point", context.getCurrentClassName());

        context.enterFunction();
        assertFalse(context.isInClassBody());
        assertEquals("Point", context.getCurrentClassName());

        context.exitFunction();
        context.exitClass();
        assertFalse(context.isInClassBody());
    }

    @Test
    void diagnosticsCarryLocation() {
        context.pushLocation("Program");
        context.pushLocation("FunctionDef(f)");
        context.pushLocation("Lambda");
        context.report("Lambda", "No rule");
        context.popLocation();

        assertEquals("Program/FunctionDef(f)", context.getLocation());
        assertEquals(1, context.getDiagnostics().size());
        EmissionDiagnostic diagnostic = context.getDiagnostics().get(0);
        assertEquals("Program/FunctionDef(f)/Lambda", diagnostic.getLocation());
        assertEquals("Lambda at Program/FunctionDef(f)/Lambda: No rule", diagnostic.toString());
    }

    @Test
    void usedFeaturesAreDeduplicated() {
        context.useFeature(RuntimeFeature.PRINT);
        context.useFeature(RuntimeFeature.PRINT);

        assertEquals(1, context.getUsedFeatures().size());
        assertThrows(UnsupportedOperationException.class,
                () -> context.getUsedFeatures().add(RuntimeFeature.LEN));
    }
}
