package me.christianrobert.retarget.translator.builder.program;

/**
 * A top-level statement after emission, tagged with whether it is a definition
 * (function or class) or a bare executable statement.
 */
public class EmittedStatement {

    private final String text;
    private final boolean definition;

    public EmittedStatement(String text, boolean definition) {
        this.text = text;
        this.definition = definition;
    }

    public String getText() {
        return text;
    }

    public boolean isDefinition() {
        return definition;
    }
}
