package me.christianrobert.retarget.translator.ast;

public class Continue extends Statement {

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitContinue(this);
    }

    @Override
    public String toString() {
        return "Continue";
    }
}
