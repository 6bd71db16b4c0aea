package me.christianrobert.retarget.translator.profile;

import me.christianrobert.retarget.translator.context.UnsupportedNodeShapeException;

import java.util.List;

/**
 * Delimiters of a sequence display (list or tuple) in a target language.
 * Constructor forms such as {@code List.of(} are expressed through the opening text.
 */
public class ContainerSyntax {

    public static final ContainerSyntax UNSUPPORTED = new ContainerSyntax(null, null, false);

    private final String open;
    private final String close;
    private final boolean singletonTrailingComma;

    public ContainerSyntax(String open, String close) {
        this(open, close, false);
    }

    public ContainerSyntax(String open, String close, boolean singletonTrailingComma) {
        this.open = open;
        this.close = close;
        this.singletonTrailingComma = singletonTrailingComma;
    }

    public boolean isSupported() {
        return open != null;
    }

    /**
     * @param items emitted item texts
     * @param kind container kind, for the diagnostic when unsupported
     */
    public String render(List<String> items, String kind) {
        if (!isSupported()) {
            throw new UnsupportedNodeShapeException("Target has no " + kind + " display");
        }
        String body = String.join(", ", items);
        if (singletonTrailingComma && items.size() == 1) {
            body = body + ",";
        }
        return open + body + close;
    }

    @Override
    public String toString() {
        return isSupported() ? "ContainerSyntax{" + open + "..." + close + "}" : "ContainerSyntax{unsupported}";
    }
}
