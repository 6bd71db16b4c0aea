package me.christianrobert.retarget.translator.profile;

/**
 * How a target delimits nested blocks.
 *
 * <ul>
 *   <li>BRACE: header and an opening brace, closed by a brace line</li>
 *   <li>INDENT: header and a colon, followed by deeper-indented lines, no closer</li>
 *   <li>END_KEYWORD: bare header, closed by an {@code end} line</li>
 * </ul>
 */
public enum BlockStyle {
    BRACE,
    INDENT,
    END_KEYWORD;

    /**
     * First line of a block, without indentation.
     */
    public String open(String header) {
        switch (this) {
            case BRACE:
                return header + " {";
            case INDENT:
                return header + ":";
            default:
                return header;
        }
    }

    /**
     * Line that closes the previous branch of a chain and opens the next one,
     * e.g. the {@code else} line of an if statement.
     */
    public String continuation(String indent, String header) {
        switch (this) {
            case BRACE:
                return indent + "} " + header + " {";
            case INDENT:
                return indent + header + ":";
            default:
                return indent + header;
        }
    }

    /**
     * Closing line of a block, or null when the style has none.
     */
    public String close(String indent) {
        switch (this) {
            case BRACE:
                return indent + "}";
            case INDENT:
                return null;
            default:
                return indent + "end";
        }
    }
}
