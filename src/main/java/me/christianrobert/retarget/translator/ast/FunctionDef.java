package me.christianrobert.retarget.translator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Function or method definition. Parameters are plain names; the origin's
 * instance parameter ("self") is still present for methods and is filtered
 * by the statement emitter according to the target profile.
 */
public class FunctionDef extends Statement {

    private final String name;
    private final List<String> params;
    private final List<Statement> body;

    public FunctionDef(String name, List<String> params, List<Statement> body) {
        this.name = requireName(name, "Function name");
        this.params = requireList(params, "Function parameters");
        this.body = requireList(body, "Function body");
    }

    public String getName() {
        return name;
    }

    public List<String> getParams() {
        return params;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return new ArrayList<>(body);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitFunctionDef(this);
    }

    @Override
    public String toString() {
        return "FunctionDef{name='" + name + "', params=" + params + "}";
    }
}
