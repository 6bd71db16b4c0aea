package me.christianrobert.retarget.translator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Class definition with its base-class expressions and member statements.
 */
public class ClassDef extends Statement {

    private final String name;
    private final List<Expression> bases;
    private final List<Statement> body;

    public ClassDef(String name, List<Expression> bases, List<Statement> body) {
        this.name = requireName(name, "Class name");
        this.bases = requireList(bases, "Class bases");
        this.body = requireList(body, "Class body");
    }

    public String getName() {
        return name;
    }

    public List<Expression> getBases() {
        return bases;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>(bases);
        children.addAll(body);
        return children;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitClassDef(this);
    }

    @Override
    public String toString() {
        return "ClassDef{name='" + name + "', bases=" + bases.size() + "}";
    }
}
