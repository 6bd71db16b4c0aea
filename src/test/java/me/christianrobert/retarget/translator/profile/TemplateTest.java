package me.christianrobert.retarget.translator.profile;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplateTest {

    @Test
    void fillsPlaceholders() {
        assertEquals("let x = 5", Template.fill("let {target} = {value}", "target", "x", "value", "5"));
        assertEquals("for i in r", Template.fill("for {var} in {iter}", Map.of("var", "i", "iter", "r")));
    }

    @Test
    void insertedTextIsNotScannedAgain() {
        assertEquals("{b} and x", Template.fill("{a} and {b}", "a", "{b}", "b", "x"));
    }

    @Test
    void literalBracesSurvive() {
        assertEquals("{k, v}", Template.fill("{{key}, {value}}", "key", "k", "value", "v"));
        assertEquals("if c { 1 }", Template.fill("if {test} { {body} }", "test", "c", "body", "1"));
        assertEquals("x interface{}", Template.fill("{target} interface{}", "target", "x"));
        assertEquals("format!(\"{}{}\", a, b)",
                Template.fill("format!(\"{}{}\", {left}, {right})", "left", "a", "right", "b"));
    }

    @Test
    void unknownPlaceholderIsKept() {
        assertEquals("{missing} 1", Template.fill("{missing} {a}", "a", "1"));
    }

    @Test
    void unpairedArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Template.fill("{a}", "a"));
    }

    @Test
    void mentions() {
        assertTrue(Template.mentions("{right}.includes({left})", "left"));
        assertFalse(Template.mentions("===", "left"));
    }
}
