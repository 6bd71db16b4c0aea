package me.christianrobert.retarget.translator;

import me.christianrobert.retarget.translator.ast.Assign;
import me.christianrobert.retarget.translator.ast.AugAssign;
import me.christianrobert.retarget.translator.ast.BinaryOperator;
import me.christianrobert.retarget.translator.ast.BoolOp;
import me.christianrobert.retarget.translator.ast.BooleanOperator;
import me.christianrobert.retarget.translator.ast.Break;
import me.christianrobert.retarget.translator.ast.CompareOperator;
import me.christianrobert.retarget.translator.ast.Conditional;
import me.christianrobert.retarget.translator.ast.Constant;
import me.christianrobert.retarget.translator.ast.Continue;
import me.christianrobert.retarget.translator.ast.DictLit;
import me.christianrobert.retarget.translator.ast.ExprStmt;
import me.christianrobert.retarget.translator.ast.Expression;
import me.christianrobert.retarget.translator.ast.For;
import me.christianrobert.retarget.translator.ast.Import;
import me.christianrobert.retarget.translator.ast.ListLit;
import me.christianrobert.retarget.translator.ast.OpaqueExpression;
import me.christianrobert.retarget.translator.ast.OpaqueStatement;
import me.christianrobert.retarget.translator.ast.Pass;
import me.christianrobert.retarget.translator.ast.Program;
import me.christianrobert.retarget.translator.ast.Statement;
import me.christianrobert.retarget.translator.ast.Subscript;
import me.christianrobert.retarget.translator.ast.TupleLit;
import me.christianrobert.retarget.translator.ast.UnaryOp;
import me.christianrobert.retarget.translator.ast.UnaryOperator;
import me.christianrobert.retarget.translator.builder.program.ProgramEmitter;
import me.christianrobert.retarget.translator.builder.program.ProgramWrapper;
import me.christianrobert.retarget.translator.context.EmissionResult;
import me.christianrobert.retarget.translator.profile.BlockStyle;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.LanguageProfiles;
import me.christianrobert.retarget.translator.profile.Template;
import me.christianrobert.retarget.translator.validation.BalanceReport;
import me.christianrobert.retarget.translator.validation.StructuralBalanceChecker;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static me.christianrobert.retarget.translator.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties every catalog entry must satisfy, checked against all profiles.
 */
class EmissionPropertiesTest {

    /**
     * One statement of every kind, and one expression statement per expression kind.
     */
    private static List<Statement> everyKind() {
        List<Expression> expressions = List.of(
                new Constant(1.5),
                Constant.none(),
                name("x"),
                call("print", str("a"), num(2)),
                call("len", name("items")),
                call("str", num(3)),
                call("range", num(5)),
                call("custom", name("x")),
                binOp(name("x"), BinaryOperator.POW, num(2)),
                binOp(str("a"), BinaryOperator.ADD, name("x")),
                compare(name("x"), CompareOperator.IN, name("items")),
                self("field"),
                new Subscript(name("items"), num(0)),
                new ListLit(List.of(num(1), num(2))),
                new DictLit(List.of(new DictLit.Pair(str("k"), num(1)))),
                new TupleLit(List.of(num(1))),
                new UnaryOp(UnaryOperator.NOT, name("x")),
                new BoolOp(BooleanOperator.OR, List.of(name("a"), name("b"))),
                new Conditional(name("c"), num(1), num(2)),
                new OpaqueExpression("Lambda"));

        List<Statement> statements = new ArrayList<>();
        for (Expression expression : expressions) {
            statements.add(new ExprStmt(expression));
        }
        statements.add(assign("x", num(1)));
        statements.add(new AugAssign(name("x"), BinaryOperator.FLOOR_DIV, num(2)));
        statements.add(ifStmt(name("x"), body(new Pass()), body(new Break())));
        statements.add(whileStmt(name("x"), new Continue()));
        statements.add(forRange("i", num(0), num(10), num(2)));
        statements.add(forRange("j", num(10), num(0), new UnaryOp(UnaryOperator.USUB, num(1))));
        statements.add(new Assign(new TupleLit(List.of(name("p"), name("q"))), new TupleLit(List.of(num(1), num(2)))));
        statements.add(new For(new TupleLit(List.of(name("k"), name("v"))), name("pairs"), body(print(name("k")))));
        statements.add(new For(name("v"), name("items"), body(print(name("v")))));
        statements.add(new Import(List.of("os")));
        statements.add(new OpaqueStatement("With"));
        statements.add(docstring("Doc."));
        statements.add(ret(name("x")));
        return statements;
    }

    private static Program everyKindProgram() {
        List<Statement> top = new ArrayList<>();
        top.add(def("f", List.of("items"), everyKind().toArray(new Statement[0])));
        top.add(classDef("Point", List.of(name("Base")),
                assign("x", num(0)),
                def("__init__", List.of("self", "x"), new Assign(self("x"), name("x"))),
                def("get", List.of("self"), ret(self("x")))));
        top.add(assign("total", num(0)));
        top.add(print(call("f", new ListLit(List.of(num(1))))));
        return new Program(top);
    }

    @Test
    void everyProfileEmitsEveryKindWithoutFailing() {
        Program program = everyKindProgram();

        for (LanguageProfile profile : LanguageProfiles.all()) {
            EmissionResult result = assertDoesNotThrow(() -> ProgramEmitter.emit(program, profile.getId()),
                    "Emission failed for " + profile.getId());
            assertFalse(result.getCode().trim().isEmpty(), "Empty output for " + profile.getId());
            // the lambda and the with statement are outside the node model everywhere
            assertTrue(result.getDiagnostics().size() >= 2, "Missing diagnostics for " + profile.getId());
        }
    }

    @Test
    void everySingleStatementKindProducesText() {
        for (LanguageProfile profile : LanguageProfiles.all()) {
            for (Statement statement : everyKind()) {
                Program program = program(def("f", List.of(), statement));
                String code = ProgramEmitter.emitProgram(program, profile.getId());
                assertFalse(code.trim().isEmpty(),
                        statement.getKind() + " produced nothing for " + profile.getId());
            }
        }
    }

    @Test
    void emissionIsDeterministic() {
        for (LanguageProfile profile : LanguageProfiles.all()) {
            String first = ProgramEmitter.emitProgram(everyKindProgram(), profile.getId());
            String second = ProgramEmitter.emitProgram(everyKindProgram(), profile.getId());
            assertEquals(first, second, "Output differs between runs for " + profile.getId());
        }
    }

    @Test
    void braceProfilesEmitBalancedBraces() {
        Program program = everyKindProgram();

        for (LanguageProfile profile : LanguageProfiles.all()) {
            if (profile.getBlockStyle() != BlockStyle.BRACE) {
                continue;
            }
            String code = ProgramEmitter.emitProgram(program, profile.getId());
            BalanceReport report = StructuralBalanceChecker.check(code, profile);
            assertTrue(report.isApplicable());
            assertEquals(report.getOpenBraces(), report.getCloseBraces(),
                    "Unbalanced braces for " + profile.getId() + ":\n" + code);
        }
    }

    @Test
    void repeatedAssignmentUsesDeclarationFormOnlyOnce() {
        Program program = program(assign("x", num(1)), assign("x", num(2)));

        for (LanguageProfile profile : LanguageProfiles.all()) {
            String target = profile.getVariableSigil() + "x";
            String declaration = Template.fill(profile.getDeclarationTemplate(), "target", target, "value", "1")
                    + profile.getTerminator();
            String assignment = Template.fill(profile.getAssignmentTemplate(), "target", target, "value", "2")
                    + profile.getTerminator();

            String code = ProgramEmitter.emitProgram(program, profile.getId());

            assertTrue(code.contains(declaration), "Missing declaration for " + profile.getId() + ":\n" + code);
            assertTrue(code.contains(assignment), "Missing assignment for " + profile.getId() + ":\n" + code);
            String secondDeclaration = Template.fill(profile.getDeclarationTemplate(), "target", target, "value", "2");
            if (!profile.getDeclarationTemplate().equals(profile.getAssignmentTemplate())) {
                assertFalse(code.contains(secondDeclaration), "Declared twice for " + profile.getId());
            }
        }
    }

    @Test
    void emptyFunctionBodyGetsOneNoOp() {
        Program program = program(def("f", List.of(), new Pass()));

        for (LanguageProfile profile : LanguageProfiles.all()) {
            int depth = ProgramWrapper.definitionDepth(profile.getWrapperStrategy()) + 1;
            String expectedLine = profile.indent(depth) + profile.noOpStatement();

            String code = ProgramEmitter.emitProgram(program, profile.getId());

            assertTrue(code.contains(expectedLine + "\n") || code.endsWith(expectedLine),
                    "Missing no-op body for " + profile.getId() + ":\n" + code);
        }
    }

    @Test
    void emptyClassBodyGetsOneNoOp() {
        Program program = program(classDef("Empty", List.of(), new Pass()));

        for (LanguageProfile profile : LanguageProfiles.all()) {
            if (!profile.isStructBlock()) {
                continue;
            }
            String code = ProgramEmitter.emitProgram(program, profile.getId());
            assertTrue(code.contains(profile.noOpStatement()), "Empty class body for " + profile.getId() + ":\n" + code);
        }
    }
}
