package me.christianrobert.retarget.translator.profile;

import me.christianrobert.retarget.translator.context.UnsupportedNodeShapeException;

import java.util.List;

/**
 * Rendering of a dictionary display. Each pair goes through {@code pairTemplate}
 * ({@code {key}} and {@code {value}}); insertion-call forms such as
 * {@code put({key}, {value});} inside a constructor block are expressed the same way.
 */
public class DictSyntax {

    public static final DictSyntax UNSUPPORTED = new DictSyntax(null, null, null, null);

    private final String open;
    private final String pairTemplate;
    private final String separator;
    private final String close;

    public DictSyntax(String open, String pairTemplate, String separator, String close) {
        this.open = open;
        this.pairTemplate = pairTemplate;
        this.separator = separator;
        this.close = close;
    }

    public boolean isSupported() {
        return open != null;
    }

    /**
     * @param pairs emitted key/value texts, two entries per pair
     */
    public String render(List<String[]> pairs) {
        if (!isSupported()) {
            throw new UnsupportedNodeShapeException("Target has no dictionary display");
        }
        StringBuilder sb = new StringBuilder(open);
        for (int i = 0; i < pairs.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            sb.append(Template.fill(pairTemplate, "key", pairs.get(i)[0], "value", pairs.get(i)[1]));
        }
        return sb.append(close).toString();
    }

    @Override
    public String toString() {
        return isSupported() ? "DictSyntax{" + open + pairTemplate + close + "}" : "DictSyntax{unsupported}";
    }
}
