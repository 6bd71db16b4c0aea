package me.christianrobert.retarget.translator.util;

import me.christianrobert.retarget.translator.ast.BinaryOperator;
import me.christianrobert.retarget.translator.ast.Constant;
import me.christianrobert.retarget.translator.ast.Program;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.retarget.translator.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SyntaxTreeFormatter - verifies tree formatting for debugging.
 */
class SyntaxTreeFormatterTest {

    @Test
    void formatsFunctionWithCall() {
        Program tree = program(def("greet", List.of("name"), print(name("name"))));

        String formatted = SyntaxTreeFormatter.format(tree);

        assertEquals("Program\n"
                + "  FunctionDef [greet(name)]\n"
                + "    ExprStmt\n"
                + "      Call\n"
                + "        Name [print]\n"
                + "        Name [name]\n", formatted);
    }

    @Test
    void showsOperatorsAndConstants() {
        String formatted = SyntaxTreeFormatter.format(binOp(num(1), BinaryOperator.ADD, str("a")));

        assertEquals("BinOp [Add]\n  Constant [1]\n  Constant [\"a\"]\n", formatted);
    }

    @Test
    void showsNoneConstant() {
        assertEquals("Constant [None]\n", SyntaxTreeFormatter.format(Constant.none()));
    }

    @Test
    void escapesLineBreaks() {
        String formatted = SyntaxTreeFormatter.format(str("a\nb"));

        assertEquals("Constant [\"a\\nb\"]\n", formatted);
    }

    @Test
    void truncatesLongText() {
        // Given
        String longText = "x".repeat(60);

        // When
        String formatted = SyntaxTreeFormatter.format(str(longText));

        // Then
        assertEquals("Constant [\"" + "x".repeat(49) + "...]\n", formatted);
    }

    @Test
    void nullTree() {
        assertEquals("(null tree)", SyntaxTreeFormatter.format(null));
    }
}
