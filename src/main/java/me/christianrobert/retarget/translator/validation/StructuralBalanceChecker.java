package me.christianrobert.retarget.translator.validation;

import me.christianrobert.retarget.translator.profile.BlockStyle;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.StringLiteralStyle;

/**
 * Post-emission check that counts block and grouping delimiters of brace-style output.
 *
 * <p>Delimiters inside string literals and line comments are ignored. Double-quoted
 * strings honor backslash escapes; for targets whose single-quoted strings escape by
 * doubling, backslashes inside them are literal.</p>
 *
 * <p>The result is diagnostic only: an imbalance becomes a warning on the translation,
 * never a failure.</p>
 */
public final class StructuralBalanceChecker {

    private StructuralBalanceChecker() {
    }

    public static BalanceReport check(String code, LanguageProfile profile) {
        if (profile.getBlockStyle() != BlockStyle.BRACE || code == null) {
            return BalanceReport.notApplicable();
        }
        String commentToken = profile.getLanguage().getCommentToken();
        boolean literalSingleQuotes = profile.getStringStyle() == StringLiteralStyle.SINGLE_QUOTED_DOUBLING;

        int openBraces = 0;
        int closeBraces = 0;
        int openParens = 0;
        int closeParens = 0;
        int openBrackets = 0;
        int closeBrackets = 0;

        char quote = 0;
        int i = 0;
        while (i < code.length()) {
            char c = code.charAt(i);

            if (quote != 0) {
                if (c == '\\' && !(quote == '\'' && literalSingleQuotes)) {
                    i += 2;
                    continue;
                }
                if (c == quote || c == '\n') {
                    quote = 0;
                }
                i++;
                continue;
            }

            if (code.startsWith(commentToken, i)) {
                int end = code.indexOf('\n', i);
                i = end < 0 ? code.length() : end + 1;
                continue;
            }

            switch (c) {
                case '"':
                case '\'':
                    quote = c;
                    break;
                case '{':
                    openBraces++;
                    break;
                case '}':
                    closeBraces++;
                    break;
                case '(':
                    openParens++;
                    break;
                case ')':
                    closeParens++;
                    break;
                case '[':
                    openBrackets++;
                    break;
                case ']':
                    closeBrackets++;
                    break;
                default:
                    break;
            }
            i++;
        }
        return new BalanceReport(true, openBraces, closeBraces, openParens, closeParens, openBrackets, closeBrackets);
    }
}
