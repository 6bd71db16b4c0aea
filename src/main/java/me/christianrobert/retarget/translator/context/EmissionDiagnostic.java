package me.christianrobert.retarget.translator.context;

/**
 * One construct that could not be rendered for the active target and was replaced by
 * the placeholder token.
 */
public class EmissionDiagnostic {

    private final String location;
    private final String nodeKind;
    private final String reason;

    public EmissionDiagnostic(String location, String nodeKind, String reason) {
        this.location = location;
        this.nodeKind = nodeKind;
        this.reason = reason;
    }

    /**
     * Breadcrumb of enclosing nodes, e.g. {@code Program/FunctionDef(greet)/Call}.
     */
    public String getLocation() {
        return location;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return nodeKind + " at " + location + ": " + reason;
    }
}
