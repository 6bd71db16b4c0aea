package me.christianrobert.retarget.translator.ast;

public class Break extends Statement {

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }

    @Override
    public String toString() {
        return "Break";
    }
}
