package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.ast.Assign;
import me.christianrobert.retarget.translator.ast.Attribute;
import me.christianrobert.retarget.translator.ast.AugAssign;
import me.christianrobert.retarget.translator.ast.BinOp;
import me.christianrobert.retarget.translator.ast.BoolOp;
import me.christianrobert.retarget.translator.ast.Break;
import me.christianrobert.retarget.translator.ast.Call;
import me.christianrobert.retarget.translator.ast.ClassDef;
import me.christianrobert.retarget.translator.ast.Compare;
import me.christianrobert.retarget.translator.ast.Conditional;
import me.christianrobert.retarget.translator.ast.Constant;
import me.christianrobert.retarget.translator.ast.Continue;
import me.christianrobert.retarget.translator.ast.DictLit;
import me.christianrobert.retarget.translator.ast.ExprStmt;
import me.christianrobert.retarget.translator.ast.For;
import me.christianrobert.retarget.translator.ast.FunctionDef;
import me.christianrobert.retarget.translator.ast.If;
import me.christianrobert.retarget.translator.ast.Import;
import me.christianrobert.retarget.translator.ast.ListLit;
import me.christianrobert.retarget.translator.ast.Name;
import me.christianrobert.retarget.translator.ast.OpaqueExpression;
import me.christianrobert.retarget.translator.ast.OpaqueStatement;
import me.christianrobert.retarget.translator.ast.Pass;
import me.christianrobert.retarget.translator.ast.Program;
import me.christianrobert.retarget.translator.ast.Return;
import me.christianrobert.retarget.translator.ast.Statement;
import me.christianrobert.retarget.translator.ast.Subscript;
import me.christianrobert.retarget.translator.ast.SyntaxNode;
import me.christianrobert.retarget.translator.ast.SyntaxVisitor;
import me.christianrobert.retarget.translator.ast.TupleLit;
import me.christianrobert.retarget.translator.ast.UnaryOp;
import me.christianrobert.retarget.translator.ast.While;
import me.christianrobert.retarget.translator.context.EmissionContext;
import me.christianrobert.retarget.translator.context.UnsupportedNodeShapeException;
import me.christianrobert.retarget.translator.profile.LanguageProfile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Renders syntax nodes as target source text, driven entirely by the context's
 * {@link LanguageProfile}.
 *
 * <p>Each visit method delegates to a static {@code Visit*} helper. Statement helpers
 * return complete lines indented for the current depth (several lines joined by
 * {@code \n}, no trailing newline); expression helpers return inline text.</p>
 *
 * <p>Helpers signal constructs the profile cannot express by throwing
 * {@link UnsupportedNodeShapeException}. {@link #visit(SyntaxNode)} contains the
 * exception: it records a diagnostic and substitutes {@link Placeholder#TOKEN}, so one
 * unrepresentable subtree never aborts the rest of the program.</p>
 */
public class TargetCodeBuilder implements SyntaxVisitor<String> {

    // no logging is desired, this would create an overkill of logs

    private final EmissionContext context;

    public TargetCodeBuilder(EmissionContext context) {
        if (context == null) {
            throw new IllegalArgumentException("EmissionContext cannot be null");
        }
        this.context = context;
    }

    public EmissionContext getContext() {
        return context;
    }

    public LanguageProfile getProfile() {
        return context.getProfile();
    }

    /**
     * Emits one node. Never throws for unsupported shapes.
     */
    public String visit(SyntaxNode node) {
        context.pushLocation(describe(node));
        try {
            return node.accept(this);
        } catch (UnsupportedNodeShapeException e) {
            context.report(node.getKind(), e.getMessage());
            return node instanceof Statement ? context.indent() + Placeholder.TOKEN : Placeholder.TOKEN;
        } finally {
            context.popLocation();
        }
    }

    /**
     * Emits a node at a fixed depth, restoring the previous depth afterwards.
     * Used by the program emitter to place top-level statements inside wrappers.
     */
    public String visitAtDepth(SyntaxNode node, int depth) {
        int saved = context.getDepth();
        context.setDepth(depth);
        try {
            return visit(node);
        } finally {
            context.setDepth(saved);
        }
    }

    /**
     * Emits expressions in order.
     */
    public List<String> visitAll(Collection<? extends SyntaxNode> nodes) {
        List<String> result = new ArrayList<>(nodes.size());
        for (SyntaxNode node : nodes) {
            result.add(visit(node));
        }
        return result;
    }

    /**
     * Emits the statements of a nested block, one level deeper than the current depth,
     * in a fresh declaration scope.
     *
     * <p>{@code pass} and nested imports produce nothing. A block that ends up without
     * any executable statement gets exactly one no-op statement; converted docstring
     * comments do not count as statements.</p>
     *
     * @param body statements of the block
     * @param boundary true for function and class bodies
     * @param declared names visible as declared inside the block (parameters, loop variables)
     * @param prelude lines placed before the body, e.g. parameter binding
     * @return the block lines, never empty
     */
    public String emitBlock(List<Statement> body, boolean boundary, List<String> declared, List<String> prelude) {
        context.enterBlock(boundary);
        try {
            for (String name : declared) {
                context.declare(name);
            }
            List<String> lines = new ArrayList<>();
            for (String line : prelude) {
                lines.add(context.indent() + line);
            }
            boolean hasStatement = false;
            for (Statement statement : body) {
                if (statement instanceof Pass || statement instanceof Import) {
                    continue;
                }
                String text = visit(statement);
                if (text.isEmpty()) {
                    continue;
                }
                lines.add(text);
                if (!isCommentOnly(statement)) {
                    hasStatement = true;
                }
            }
            if (!hasStatement) {
                lines.add(context.indent() + getProfile().noOpStatement());
            }
            return String.join("\n", lines);
        } finally {
            context.exitBlock();
        }
    }

    public String emitBlock(List<Statement> body, boolean boundary) {
        return emitBlock(body, boundary, List.of(), List.of());
    }

    private boolean isCommentOnly(Statement statement) {
        return statement instanceof ExprStmt
                && ((ExprStmt) statement).isDocstring()
                && !getProfile().isKeepDocstrings();
    }

    private static String describe(SyntaxNode node) {
        if (node instanceof FunctionDef) {
            return node.getKind() + "(" + ((FunctionDef) node).getName() + ")";
        }
        if (node instanceof ClassDef) {
            return node.getKind() + "(" + ((ClassDef) node).getName() + ")";
        }
        return node.getKind();
    }

    // ========== PROGRAM ==========

    @Override
    public String visitProgram(Program node) {
        // Whole programs are wrapped by ProgramEmitter; here the body is emitted plainly.
        List<String> parts = new ArrayList<>();
        for (Statement statement : node.getBody()) {
            if (statement instanceof Import) {
                continue;
            }
            parts.add(visit(statement));
        }
        return String.join("\n", parts);
    }

    // ========== STATEMENTS ==========

    @Override
    public String visitFunctionDef(FunctionDef node) {
        return VisitFunctionDef.v(node, this);
    }

    @Override
    public String visitClassDef(ClassDef node) {
        return VisitClassDef.v(node, this);
    }

    @Override
    public String visitAssign(Assign node) {
        return VisitAssign.v(node, this);
    }

    @Override
    public String visitAugAssign(AugAssign node) {
        return VisitAugAssign.v(node, this);
    }

    @Override
    public String visitIf(If node) {
        return VisitIf.v(node, this);
    }

    @Override
    public String visitFor(For node) {
        return VisitFor.v(node, this);
    }

    @Override
    public String visitWhile(While node) {
        return VisitWhile.v(node, this);
    }

    @Override
    public String visitReturn(Return node) {
        return VisitReturn.v(node, this);
    }

    @Override
    public String visitExprStmt(ExprStmt node) {
        return VisitExprStmt.v(node, this);
    }

    @Override
    public String visitPass(Pass node) {
        return VisitSimpleStatement.pass(this);
    }

    @Override
    public String visitBreak(Break node) {
        return VisitSimpleStatement.breakLoop(this);
    }

    @Override
    public String visitContinue(Continue node) {
        return VisitSimpleStatement.continueLoop(this);
    }

    @Override
    public String visitImport(Import node) {
        // Import lines are synthesized from used features, never translated.
        return "";
    }

    @Override
    public String visitOpaqueStatement(OpaqueStatement node) {
        throw new UnsupportedNodeShapeException("No rule for statement kind '" + node.getKind() + "'");
    }

    // ========== EXPRESSIONS ==========

    @Override
    public String visitConstant(Constant node) {
        return VisitConstant.v(node, this);
    }

    @Override
    public String visitName(Name node) {
        return VisitName.v(node, this);
    }

    @Override
    public String visitCall(Call node) {
        return VisitCall.v(node, this);
    }

    @Override
    public String visitBinOp(BinOp node) {
        return VisitBinOp.v(node, this);
    }

    @Override
    public String visitCompare(Compare node) {
        return VisitCompare.v(node, this);
    }

    @Override
    public String visitAttribute(Attribute node) {
        return VisitAttribute.v(node, this);
    }

    @Override
    public String visitSubscript(Subscript node) {
        return VisitSubscript.v(node, this);
    }

    @Override
    public String visitListLit(ListLit node) {
        return VisitContainerLiteral.list(node, this);
    }

    @Override
    public String visitDictLit(DictLit node) {
        return VisitContainerLiteral.dict(node, this);
    }

    @Override
    public String visitTupleLit(TupleLit node) {
        return VisitContainerLiteral.tuple(node, this);
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        return VisitUnaryOp.v(node, this);
    }

    @Override
    public String visitBoolOp(BoolOp node) {
        return VisitBoolOp.v(node, this);
    }

    @Override
    public String visitConditional(Conditional node) {
        return VisitConditional.v(node, this);
    }

    @Override
    public String visitOpaqueExpression(OpaqueExpression node) {
        throw new UnsupportedNodeShapeException("No rule for expression kind '" + node.getKind() + "'");
    }
}
