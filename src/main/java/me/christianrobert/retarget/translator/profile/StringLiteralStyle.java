package me.christianrobert.retarget.translator.profile;

/**
 * Quoting rules for string constants.
 */
public enum StringLiteralStyle {
    /** {@code "..."} with backslash escapes. */
    DOUBLE_QUOTED('"'),
    /** {@code '...'} where the quote is escaped by doubling and backslashes are literal. */
    SINGLE_QUOTED_DOUBLING('\'');

    private final char quote;

    StringLiteralStyle(char quote) {
        this.quote = quote;
    }

    public char getQuote() {
        return quote;
    }

    /**
     * Quotes a string value.
     *
     * @param value raw string
     * @param interpolationEscapes characters the target interpolates inside this kind of
     *                             literal (e.g. {@code $}); they are backslash-escaped
     */
    public String quote(String value, String interpolationEscapes) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append(quote);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (this == SINGLE_QUOTED_DOUBLING) {
                if (c == quote) {
                    sb.append(quote);
                }
                sb.append(c);
                continue;
            }
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c == quote || interpolationEscapes.indexOf(c) >= 0) {
                        sb.append('\\');
                    }
                    sb.append(c);
            }
        }
        sb.append(quote);
        return sb.toString();
    }
}
