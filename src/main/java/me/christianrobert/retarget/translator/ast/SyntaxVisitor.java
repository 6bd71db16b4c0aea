package me.christianrobert.retarget.translator.ast;

/**
 * Visitor over the closed node model. One method per node kind.
 *
 * @param <R> result type of a visit
 */
public interface SyntaxVisitor<R> {

    R visitProgram(Program node);

    // statements

    R visitFunctionDef(FunctionDef node);

    R visitClassDef(ClassDef node);

    R visitAssign(Assign node);

    R visitAugAssign(AugAssign node);

    R visitIf(If node);

    R visitFor(For node);

    R visitWhile(While node);

    R visitReturn(Return node);

    R visitExprStmt(ExprStmt node);

    R visitPass(Pass node);

    R visitBreak(Break node);

    R visitContinue(Continue node);

    R visitImport(Import node);

    R visitOpaqueStatement(OpaqueStatement node);

    // expressions

    R visitConstant(Constant node);

    R visitName(Name node);

    R visitCall(Call node);

    R visitBinOp(BinOp node);

    R visitCompare(Compare node);

    R visitAttribute(Attribute node);

    R visitSubscript(Subscript node);

    R visitListLit(ListLit node);

    R visitDictLit(DictLit node);

    R visitTupleLit(TupleLit node);

    R visitUnaryOp(UnaryOp node);

    R visitBoolOp(BoolOp node);

    R visitConditional(Conditional node);

    R visitOpaqueExpression(OpaqueExpression node);
}
