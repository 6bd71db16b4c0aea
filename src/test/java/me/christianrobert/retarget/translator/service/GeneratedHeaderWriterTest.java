package me.christianrobert.retarget.translator.service;

import me.christianrobert.retarget.translator.profile.LanguageProfiles;
import me.christianrobert.retarget.translator.profile.TargetLanguage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeneratedHeaderWriterTest {

    private GeneratedHeaderWriter writer;

    @BeforeEach
    void setUp() {
        writer = new GeneratedHeaderWriter();
    }

    @Test
    void headerUsesCommentToken() {
        String header = writer.header(TargetLanguage.LUA, "retarget");

        assertEquals("-- ========================================\n"
                + "-- Tool: retarget\n"
                + "-- Source: Python\n"
                + "-- Target: Lua\n"
                + "-- ========================================", header);
    }

    @Test
    void headerGoesOnTop() {
        String result = writer.prepend("console.log(1);", LanguageProfiles.resolve("js"), "retarget");

        assertTrue(result.startsWith("// ===="));
        assertTrue(result.endsWith("// Target: JavaScript\n// " + GeneratedHeaderWriter.RULE + "\n\nconsole.log(1);"));
    }

    @Test
    void headerGoesAfterScriptTag() {
        String result = writer.prepend("<?php\n\necho 1 . PHP_EOL;\n\n?>", LanguageProfiles.resolve("php"), "retarget");

        assertTrue(result.startsWith("<?php\n// " + GeneratedHeaderWriter.RULE + "\n"), result);
        assertTrue(result.endsWith("// Target: PHP\n// " + GeneratedHeaderWriter.RULE + "\n\necho 1 . PHP_EOL;\n\n?>"), result);
    }
}
