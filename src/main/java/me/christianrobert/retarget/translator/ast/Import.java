package me.christianrobert.retarget.translator.ast;

import java.util.List;

/**
 * Import-like statement. Only the imported module names are kept; imports are
 * never translated, they are reported and replaced by synthesized target imports.
 */
public class Import extends Statement {

    private final List<String> modules;

    public Import(List<String> modules) {
        this.modules = requireList(modules, "Imported modules");
    }

    public List<String> getModules() {
        return modules;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitImport(this);
    }

    @Override
    public String toString() {
        return "Import{" + modules + "}";
    }
}
