package me.christianrobert.retarget.translator.builder;

/**
 * Marker emitted in place of any construct the active target cannot express.
 * Callers scan for it to warn about incomplete output.
 */
public final class Placeholder {

    public static final String TOKEN = "__UNTRANSLATABLE__";

    private Placeholder() {
    }

    /**
     * Number of placeholder occurrences in emitted text.
     */
    public static int count(String code) {
        if (code == null || code.isEmpty()) {
            return 0;
        }
        int count = 0;
        int index = code.indexOf(TOKEN);
        while (index >= 0) {
            count++;
            index = code.indexOf(TOKEN, index + TOKEN.length());
        }
        return count;
    }
}
