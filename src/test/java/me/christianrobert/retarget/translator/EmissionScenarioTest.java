package me.christianrobert.retarget.translator;

import me.christianrobert.retarget.translator.ast.BinaryOperator;
import me.christianrobert.retarget.translator.ast.ExprStmt;
import me.christianrobert.retarget.translator.ast.OpaqueExpression;
import me.christianrobert.retarget.translator.ast.Program;
import me.christianrobert.retarget.translator.builder.Placeholder;
import me.christianrobert.retarget.translator.builder.program.ProgramEmitter;
import me.christianrobert.retarget.translator.context.EmissionDiagnostic;
import me.christianrobert.retarget.translator.context.EmissionResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.retarget.translator.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end emission of small programs, one scenario per core behavior.
 *
 * <h3>Covered:</h3>
 * <pre>
 * def greet(name): print(name)        → JavaScript function with console.log
 * x = 5; x = 6                        → Go declares once, then assigns
 * for i in range(3): print(i)         → range rewritten, never called as range()
 * lambda (outside the node model)     → placeholder token, no exception
 * functions only, Java                → one class, members plus an empty main
 * </pre>
 */
class EmissionScenarioTest {

    @Test
    void functionWithPrintToJavaScript() {
        // Given: def greet(name): print(name)
        Program program = program(def("greet", List.of("name"), print(name("name"))));

        // When
        String code = ProgramEmitter.emitProgram(program, "javascript");

        // Then: function greet whose single statement is console.log(name)
        assertEquals("function greet(name) {\n"
                + "    console.log(name);\n"
                + "}", code);
    }

    @Test
    void repeatedAssignmentDeclaresOnceInGo() {
        // Given: x = 5 followed by x = 6 in the same scope
        Program program = program(assign("x", num(5)), assign("x", num(6)));

        // When
        String code = ProgramEmitter.emitProgram(program, "go");

        // Then: := the first time, = the second time
        assertEquals("package main\n\n"
                + "func main() {\n"
                + "\tx := 5\n"
                + "\tx = 6\n"
                + "}", code);
    }

    @Test
    void rangeLoopBecomesSequenceConstructionInJavaScript() {
        // Given: for i in range(3): print(i)
        Program program = program(forRange("i", num(3)));

        // When
        String code = ProgramEmitter.emitProgram(program, "js");

        // Then: iteration over an explicit sequence, no range() call left
        assertEquals("for (let i of Array.from({length: 3}, (_, i) => i)) {\n"
                + "    console.log(i);\n"
                + "}", code);
        assertFalse(code.contains("range("));
    }

    @Test
    void rangeLoopBecomesRubyRangeLiteral() {
        Program program = program(forRange("i", num(1), num(4)));

        String code = ProgramEmitter.emitProgram(program, "ruby");

        assertEquals("(1...4).each do |i|\n"
                + "  puts(i)\n"
                + "end", code);
    }

    @Test
    void unknownExpressionKindEmitsPlaceholder() {
        // Given: an expression statement holding a node kind the model does not cover
        Program program = program(new ExprStmt(new OpaqueExpression("Lambda")));

        // When: emission must not raise
        EmissionResult result = assertDoesNotThrow(() -> ProgramEmitter.emit(program, "javascript"));

        // Then
        assertEquals(Placeholder.TOKEN + ";", result.getCode());
        assertEquals(1, result.getDiagnostics().size());
        EmissionDiagnostic diagnostic = result.getDiagnostics().get(0);
        assertEquals("Lambda", diagnostic.getNodeKind());
        assertEquals("Program/ExprStmt/Lambda", diagnostic.getLocation());
    }

    @Test
    void functionsOnlyProgramGetsEmptyEntryPointInJava() {
        // Given: only top-level function definitions
        Program program = program(
                def("add", List.of("a", "b"), ret(binOp(name("a"), BinaryOperator.ADD, name("b")))),
                def("hello", List.of(), print(str("hi"))));

        // When
        String code = ProgramEmitter.emitProgram(program, "java");

        // Then: one wrapping class, both functions as members, main without statements
        assertEquals("public class Main {\n"
                + "    public static Object add(Object a, Object b) {\n"
                + "        return a + b;\n"
                + "    }\n"
                + "\n"
                + "    public static Object hello() {\n"
                + "        System.out.println(\"hi\");\n"
                + "    }\n"
                + "\n"
                + "    public static void main(String[] args) {\n"
                + "    }\n"
                + "}", code);
    }

    @Test
    void wrapperNameIsConfigurable() {
        Program program = program(print(num(1)));

        String code = ProgramEmitter.emit(program, "csharp", "Converted").getCode();

        assertTrue(code.startsWith("public class Converted {"), code);
        assertTrue(code.contains("        Console.WriteLine(1);"), code);
    }
}
