package me.christianrobert.retarget.translator.ast;

public class Pass extends Statement {

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitPass(this);
    }

    @Override
    public String toString() {
        return "Pass";
    }
}
