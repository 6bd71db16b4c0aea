package me.christianrobert.retarget.translator;

import me.christianrobert.retarget.translator.ast.Assign;
import me.christianrobert.retarget.translator.ast.ClassDef;
import me.christianrobert.retarget.translator.ast.Pass;
import me.christianrobert.retarget.translator.ast.Program;
import me.christianrobert.retarget.translator.builder.Placeholder;
import me.christianrobert.retarget.translator.builder.program.ProgramEmitter;
import me.christianrobert.retarget.translator.context.EmissionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.retarget.translator.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for class emission in both layouts.
 *
 * <pre>
 * class Point(Base):
 *     count = 0
 *     def __init__(self, x):
 *         self.x = x
 *     def get(self):
 *         return self.x
 * </pre>
 */
class ClassTranslationTest {

    private ClassDef point;

    @BeforeEach
    void setUp() {
        point = classDef("Point", List.of(),
                assign("x", num(0)),
                def("__init__", List.of("self", "x"), new Assign(self("x"), name("x"))),
                def("get", List.of("self"), ret(self("x"))));
    }

    // ==================== NESTED LAYOUT ====================

    @Test
    void javaScriptClassWithConstructorAndMethod() {
        // Given
        Program program = program(classDef("Point", List.of(name("Base")),
                assign("count", num(0)),
                def("__init__", List.of("self", "x"), new Assign(self("x"), name("x"))),
                def("get", List.of("self"), ret(self("x")))));

        // When
        String code = ProgramEmitter.emitProgram(program, "javascript");

        // Then
        assertEquals("class Point extends Base {\n"
                + "    count = 0;\n"
                + "    constructor(x) {\n"
                + "        this.x = x;\n"
                + "    }\n"
                + "    get() {\n"
                + "        return this.x;\n"
                + "    }\n"
                + "}", code);
    }

    @Test
    void singleInheritanceKeepsFirstBase() {
        Program program = program(classDef("C", List.of(name("A"), name("B")), new Pass()));

        EmissionResult result = ProgramEmitter.emit(program, "java");

        assertTrue(result.getCode().contains("    static class C extends A {"), result.getCode());
        assertFalse(result.getCode().contains("B"), result.getCode());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals("ClassDef", result.getDiagnostics().get(0).getNodeKind());
    }

    @Test
    void pythonKeepsAllBases() {
        Program program = program(classDef("C", List.of(name("A"), name("B")), new Pass()));

        assertEquals("class C(A, B):\n    pass", ProgramEmitter.emitProgram(program, "python"));
    }

    @Test
    void implicitObjectBaseIsSkipped() {
        Program program = program(classDef("C", List.of(name("object")), new Pass()));

        assertEquals("class C:\n    pass", ProgramEmitter.emitProgram(program, "python"));
    }

    @Test
    void cppClassHasPreambleAndTerminator() {
        Program program = program(classDef("P", List.of(name("A"), name("B")), assign("n", num(1))));

        String code = ProgramEmitter.emitProgram(program, "cpp");

        assertTrue(code.contains("class P : public A, public B {\n    public:\n    int n = 1;\n};"), code);
    }

    @Test
    void kotlinBaseIsConstructorCall() {
        Program program = program(classDef("C", List.of(name("Base")), new Pass()));

        String code = ProgramEmitter.emitProgram(program, "kotlin");

        assertTrue(code.startsWith("class C : Base() {"), code);
    }

    // ==================== DETACHED LAYOUT ====================

    @Test
    void goStructWithReceiverMethods() {
        String code = ProgramEmitter.emitProgram(program(point), "go");

        assertTrue(code.contains("type Point struct {\n\tx interface{}\n}"), code);
        assertTrue(code.contains("func NewPoint(x interface{}) *Point {\n\tself.x = x\n}"), code);
        assertTrue(code.contains("func (self *Point) get() {\n\treturn self.x\n}"), code);
    }

    @Test
    void rustMethodsGoInImplBlock() {
        String code = ProgramEmitter.emitProgram(program(point), "rust");

        assertTrue(code.contains("struct Point {\n    x: i64,\n}"), code);
        assertTrue(code.contains("impl Point {\n    fn new(x: i64) -> Self {\n        self.x = x;\n    }"), code);
        assertTrue(code.contains("    fn get(&mut self) {\n        return self.x;\n    }\n}"), code);
    }

    @Test
    void luaTableWithFunctions() {
        String code = ProgramEmitter.emitProgram(program(point), "lua");

        assertEquals("Point = {}\n"
                + "Point.x = 0\n"
                + "\n"
                + "function Point.new(x)\n"
                + "  self.x = x\n"
                + "end\n"
                + "\n"
                + "function Point:get()\n"
                + "  return self.x\n"
                + "end", code);
    }

    @Test
    void statementInDetachedClassBodyIsUntranslatable() {
        Program program = program(classDef("P", List.of(), print(num(1)), assign("x", num(0))));

        EmissionResult result = ProgramEmitter.emit(program, "go");

        assertTrue(result.getCode().contains(Placeholder.TOKEN + "\ntype P struct {"), result.getCode());
        assertEquals("ExprStmt", result.getDiagnostics().get(0).getNodeKind());
    }

    @Test
    void detachedClassDocstringBecomesComment() {
        Program program = program(classDef("P", List.of(), docstring("A point."), assign("x", num(0))));

        String code = ProgramEmitter.emitProgram(program, "go");

        assertTrue(code.contains("// A point.\ntype P struct {"), code);
    }
}
