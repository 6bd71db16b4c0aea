package me.christianrobert.retarget.translator;

import me.christianrobert.retarget.translator.ast.Assign;
import me.christianrobert.retarget.translator.ast.AugAssign;
import me.christianrobert.retarget.translator.ast.BinaryOperator;
import me.christianrobert.retarget.translator.ast.Break;
import me.christianrobert.retarget.translator.ast.CompareOperator;
import me.christianrobert.retarget.translator.ast.Continue;
import me.christianrobert.retarget.translator.ast.Expression;
import me.christianrobert.retarget.translator.ast.For;
import me.christianrobert.retarget.translator.ast.Import;
import me.christianrobert.retarget.translator.ast.OpaqueStatement;
import me.christianrobert.retarget.translator.ast.Pass;
import me.christianrobert.retarget.translator.ast.Program;
import me.christianrobert.retarget.translator.ast.Return;
import me.christianrobert.retarget.translator.ast.TupleLit;
import me.christianrobert.retarget.translator.ast.UnaryOp;
import me.christianrobert.retarget.translator.ast.UnaryOperator;
import me.christianrobert.retarget.translator.builder.Placeholder;
import me.christianrobert.retarget.translator.builder.program.ProgramEmitter;
import me.christianrobert.retarget.translator.context.EmissionResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static me.christianrobert.retarget.translator.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for statement emission: branches, loops, assignments, returns and docstrings.
 */
class StatementTranslationTest {

    private static TupleLit tuple(Expression... items) {
        return new TupleLit(Arrays.asList(items));
    }

    private static UnaryOp negative(int value) {
        return new UnaryOp(UnaryOperator.USUB, num(value));
    }

    // ==================== IF ====================

    @Test
    void elifChainStaysFlatInPython() {
        // Given
        Program program = program(ifStmt(compare(name("x"), CompareOperator.GT, num(1)),
                body(print(name("x"))),
                body(ifStmt(compare(name("x"), CompareOperator.EQ, num(1)),
                        body(new Pass()),
                        body(print(num(0)))))));

        // When
        String code = ProgramEmitter.emitProgram(program, "python");

        // Then
        assertEquals("if x > 1:\n    print(x)\nelif x == 1:\n    pass\nelse:\n    print(0)", code);
    }

    @Test
    void ifElseWithBraces() {
        Program program = program(ifStmt(name("ok"), body(print(num(1))), body(print(num(2)))));

        String code = ProgramEmitter.emitProgram(program, "javascript");

        assertEquals("if (ok) {\n    console.log(1);\n} else {\n    console.log(2);\n}", code);
    }

    @Test
    void elsifChainWithEndKeyword() {
        Program program = program(ifStmt(name("a"),
                body(print(num(1))),
                body(ifStmt(name("b"), body(print(num(2))), body()))));

        String code = ProgramEmitter.emitProgram(program, "ruby");

        assertEquals("if a\n  puts(1)\nelsif b\n  puts(2)\nend", code);
    }

    // ==================== LOOPS ====================

    @Test
    void whileWithCompoundAssignment() {
        Program program = program(
                assign("x", num(3)),
                whileStmt(compare(name("x"), CompareOperator.GT, num(0)),
                        new AugAssign(name("x"), BinaryOperator.SUB, num(1))));

        String code = ProgramEmitter.emitProgram(program, "ruby");

        assertEquals("x = 3\n\nwhile x > 0\n  x -= 1\nend", code);
    }

    @Test
    void augmentedAssignmentExpandsWithoutCompoundForm() {
        Program program = program(
                assign("x", num(0)),
                new AugAssign(name("x"), BinaryOperator.ADD, num(1)));

        String code = ProgramEmitter.emitProgram(program, "lua");

        assertEquals("local x = 0\n\nx = x + 1", code);
    }

    @Test
    void augmentedAssignmentWithFunctionOperator() {
        Program program = program(
                assign("x", num(10)),
                new AugAssign(name("x"), BinaryOperator.FLOOR_DIV, num(3)));

        String code = ProgramEmitter.emitProgram(program, "javascript");

        assertTrue(code.contains("x = Math.floor(x / 3);"), code);
    }

    @Test
    void breakAndContinueKeywords() {
        Program program = program(whileStmt(name("running"), new Continue(), new Break()));

        String code = ProgramEmitter.emitProgram(program, "perl");

        assertEquals("while ($running) {\n    next;\n    last;\n}", code);
    }

    @Test
    void countedLoopForRange() {
        Program program = program(forRange("i", num(3)));

        String code = ProgramEmitter.emitProgram(program, "php");

        assertTrue(code.contains("for ($i = 0; $i < 3; $i += 1) {\n    echo $i . PHP_EOL;\n}"), code);
    }

    @Test
    void countedLoopWithNegativeStepCountsDown() {
        Program program = program(forRange("i", num(10), num(0), negative(1)));

        String java = ProgramEmitter.emitProgram(program, "java");
        String lua = ProgramEmitter.emitProgram(program, "lua");

        assertTrue(java.contains("for (int i = 10; i > 0; i += -1) {"), java);
        assertEquals("for i = 10, 0 + 1, -1 do\n  print(i)\nend", lua);
    }

    @Test
    void negativeStepRangeWithoutCountedLoop() {
        Program program = program(forRange("i", num(10), num(0), negative(2)));

        String code = ProgramEmitter.emitProgram(program, "rust");

        assertTrue(code.contains("for i in ((0 + 1)..=10).rev().step_by(2) {"), code);
    }

    @Test
    void stepOfUnknownSignIteratesValues() {
        Program program = program(forRange("i", num(0), num(10), name("step")));

        String code = ProgramEmitter.emitProgram(program, "php");

        assertTrue(code.contains("foreach (range(0, 10 - 1, $step) as $i) {"), code);
        assertFalse(code.contains("$i < 10"), code);
    }

    @Test
    void luaContinueJumpsToLabelAtEndOfBody() {
        Program program = program(whileStmt(name("a"), new Continue()));

        String code = ProgramEmitter.emitProgram(program, "lua");

        assertEquals("while a do\n  goto continue\n  ::continue::\nend", code);
    }

    @Test
    void luaLabelBelongsToTheLoopThatContinues() {
        // Given
        Program program = program(new For(name("x"), name("xs"), List.of(
                ifStmt(name("x"), body(new Continue()), body()),
                whileStmt(name("b"), new Break()))));

        // When
        String code = ProgramEmitter.emitProgram(program, "lua");

        // Then
        assertEquals("for _, x in ipairs(xs) do\n"
                + "  if x then\n"
                + "    goto continue\n"
                + "  end\n"
                + "  while b do\n"
                + "    break\n"
                + "  end\n"
                + "  ::continue::\n"
                + "end", code);
    }

    @Test
    void continueNeedsNoLabelElsewhere() {
        Program program = program(whileStmt(name("a"), new Continue()));

        assertEquals("while (a) {\n    continue;\n}", ProgramEmitter.emitProgram(program, "javascript"));
    }

    @Test
    void tupleLoopVariableDestructures() {
        Program program = program(new For(tuple(name("k"), name("v")), name("pairs"),
                List.of(assign("k", name("v")))));

        String go = ProgramEmitter.emitProgram(program, "go");
        String js = ProgramEmitter.emitProgram(program, "javascript");

        assertTrue(go.contains("\tfor k, v := range pairs {\n\t\tk = v\n\t}"), go);
        assertEquals("for (let [k, v] of pairs) {\n    k = v;\n}", js);
    }

    @Test
    void tupleLoopVariableWithoutDestructuringIsUntranslatable() {
        Program program = program(new For(tuple(name("k"), name("v")), name("pairs"), List.of(print(name("k")))));

        EmissionResult result = ProgramEmitter.emit(program, "lua");

        assertTrue(result.getCode().contains(Placeholder.TOKEN), result.getCode());
        assertFalse(result.getCode().contains("{k, v}"), result.getCode());
        assertEquals("For", result.getDiagnostics().get(0).getNodeKind());
    }

    @Test
    void valueLoopWithoutIterationFormIsUntranslatable() {
        Program program = program(new For(name("i"), name("items"), List.of(print(name("i")))));

        EmissionResult result = ProgramEmitter.emit(program, "c");

        assertTrue(result.getCode().contains("    " + Placeholder.TOKEN), result.getCode());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals("For", result.getDiagnostics().get(0).getNodeKind());
    }

    @Test
    void loopVariableIsNotRedeclaredInBody() {
        Program program = program(new For(name("item"), name("items"),
                List.of(assign("item", num(0)))));

        String code = ProgramEmitter.emitProgram(program, "javascript");

        assertEquals("for (let item of items) {\n    item = 0;\n}", code);
    }

    // ==================== DECLARATIONS ====================

    @Test
    void parameterAssignmentIsNotADeclaration() {
        Program program = program(def("f", List.of("x"), assign("x", num(1))));

        String code = ProgramEmitter.emitProgram(program, "go");

        assertTrue(code.contains("func f(x interface{}) {\n\tx = 1\n}"), code);
        assertFalse(code.contains(":="), code);
    }

    @Test
    void nestedFunctionDeclaresAgain() {
        Program program = program(
                assign("x", num(1)),
                def("f", List.of(), assign("x", num(2))));

        String code = ProgramEmitter.emitProgram(program, "javascript");

        assertEquals("let x = 1;\n\nfunction f() {\n    let x = 2;\n}", code);
    }

    @Test
    void reassignmentInsideIfUsesOuterDeclaration() {
        Program program = program(
                assign("x", num(1)),
                ifStmt(name("c"), body(assign("x", num(2))), body()));

        String code = ProgramEmitter.emitProgram(program, "javascript");

        assertEquals("let x = 1;\n\nif (c) {\n    x = 2;\n}", code);
    }

    @Test
    void declarationInsideIfDoesNotLeak() {
        Program program = program(
                ifStmt(name("c"), body(assign("y", num(1))), body()),
                assign("y", num(2)));

        String code = ProgramEmitter.emitProgram(program, "javascript");

        assertEquals("if (c) {\n    let y = 1;\n}\n\nlet y = 2;", code);
    }

    @Test
    void tupleAssignmentDeclaresThenReassigns() {
        Program program = program(
                new Assign(tuple(name("a"), name("b")), tuple(num(1), num(2))),
                new Assign(tuple(name("a"), name("b")), tuple(name("b"), name("a"))));

        String code = ProgramEmitter.emitProgram(program, "javascript");

        assertEquals("let [a, b] = [1, 2];\n\n[a, b] = [b, a];", code);
    }

    @Test
    void tupleAssignmentUsesParallelFormWhereNative() {
        Program program = program(
                new Assign(tuple(name("a"), name("b")), tuple(num(1), num(2))),
                assign("a", num(3)));

        String go = ProgramEmitter.emitProgram(program, "go");

        assertTrue(go.contains("\ta, b := 1, 2"), go);
        assertTrue(go.contains("\ta = 3"), go);
        assertFalse(go.contains("a := 3"), go);
        assertTrue(ProgramEmitter.emitProgram(program, "python").startsWith("a, b = 1, 2"));
    }

    @Test
    void tupleAssignmentWithoutDestructuringIsUntranslatable() {
        // Given
        Program program = program(new Assign(tuple(name("a"), name("b")), tuple(num(1), num(2))));

        // When
        EmissionResult result = ProgramEmitter.emit(program, "java");

        // Then
        assertTrue(result.getCode().contains(Placeholder.TOKEN), result.getCode());
        assertFalse(result.getCode().contains("List.of(a, b) ="), result.getCode());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals("Assign", result.getDiagnostics().get(0).getNodeKind());
    }

    @Test
    void tupleTargetOfNonNamesIsUntranslatable() {
        Program program = program(new Assign(tuple(self("x"), name("b")), name("pair")));

        EmissionResult result = ProgramEmitter.emit(program, "javascript");

        assertTrue(result.getCode().contains(Placeholder.TOKEN), result.getCode());
        assertEquals("Assign", result.getDiagnostics().get(0).getNodeKind());
    }

    // ==================== FUNCTIONS ====================

    @Test
    void perlBindsParametersInBody() {
        Program program = program(def("add", List.of("a", "b"),
                ret(binOp(name("a"), BinaryOperator.ADD, name("b")))));

        String code = ProgramEmitter.emitProgram(program, "perl");

        assertEquals("sub add {\n    my ($a, $b) = @_;\n    return $a + $b;\n}", code);
    }

    @Test
    void bareReturnUsesTargetForm() {
        Program program = program(def("f", List.of(), new Return()));

        assertEquals("f <- function() {\n  return()\n}", ProgramEmitter.emitProgram(program, "r"));
        assertEquals("def f():\n    return", ProgramEmitter.emitProgram(program, "python"));
    }

    @Test
    void docstringOnlyBodyStillGetsNoOp() {
        Program program = program(def("f", List.of(), docstring("Only docs.")));

        String code = ProgramEmitter.emitProgram(program, "javascript");

        assertEquals("function f() {\n    // Only docs.\n    ;\n}", code);
    }

    @Test
    void pythonKeepsDocstrings() {
        Program program = program(def("f", List.of(), docstring("Doc.")));

        String code = ProgramEmitter.emitProgram(program, "python");

        assertEquals("def f():\n    \"Doc.\"", code);
    }

    @Test
    void multilineDocstringBecomesLineComments() {
        Program program = program(docstring("Line one.\n\nLine two.\n"));

        String code = ProgramEmitter.emitProgram(program, "ruby");

        assertEquals("# Line one.\n#\n# Line two.", code);
    }

    // ==================== IMPORTS AND UNKNOWN STATEMENTS ====================

    @Test
    void topLevelImportsAreDroppedAndReported() {
        Program program = program(new Import(List.of("os", "sys")), print(num(1)));

        EmissionResult result = ProgramEmitter.emit(program, "javascript");

        assertEquals("console.log(1);", result.getCode());
        assertEquals(List.of("os", "sys"), result.getDroppedImports());
        assertFalse(result.hasDiagnostics());
    }

    @Test
    void nestedImportsAreDropped() {
        Program program = program(def("f", List.of(), new Import(List.of("os")), print(num(1))));

        String code = ProgramEmitter.emitProgram(program, "javascript");

        assertEquals("function f() {\n    console.log(1);\n}", code);
    }

    @Test
    void unknownStatementBecomesPlaceholder() {
        Program program = program(def("f", List.of(), new OpaqueStatement("With")));

        EmissionResult result = ProgramEmitter.emit(program, "javascript");

        assertEquals("function f() {\n    " + Placeholder.TOKEN + "\n}", result.getCode());
        assertEquals("Program/FunctionDef(f)/With", result.getDiagnostics().get(0).getLocation());
    }
}
