package me.christianrobert.retarget.translator.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Opening and closing delimiter counts of emitted code.
 */
public class BalanceReport {

    private static final BalanceReport NOT_APPLICABLE = new BalanceReport(false, 0, 0, 0, 0, 0, 0);

    private final boolean applicable;
    private final int openBraces;
    private final int closeBraces;
    private final int openParens;
    private final int closeParens;
    private final int openBrackets;
    private final int closeBrackets;

    public BalanceReport(boolean applicable, int openBraces, int closeBraces,
                         int openParens, int closeParens, int openBrackets, int closeBrackets) {
        this.applicable = applicable;
        this.openBraces = openBraces;
        this.closeBraces = closeBraces;
        this.openParens = openParens;
        this.closeParens = closeParens;
        this.openBrackets = openBrackets;
        this.closeBrackets = closeBrackets;
    }

    /**
     * Report for targets whose blocks are not delimited by braces.
     */
    public static BalanceReport notApplicable() {
        return NOT_APPLICABLE;
    }

    public boolean isApplicable() {
        return applicable;
    }

    public boolean isBalanced() {
        return !applicable
                || (openBraces == closeBraces && openParens == closeParens && openBrackets == closeBrackets);
    }

    public int getOpenBraces() {
        return openBraces;
    }

    public int getCloseBraces() {
        return closeBraces;
    }

    public int getOpenParens() {
        return openParens;
    }

    public int getCloseParens() {
        return closeParens;
    }

    public int getOpenBrackets() {
        return openBrackets;
    }

    public int getCloseBrackets() {
        return closeBrackets;
    }

    /**
     * One message per mismatched delimiter kind; empty when balanced.
     */
    public List<String> getMismatches() {
        List<String> mismatches = new ArrayList<>();
        if (!applicable) {
            return mismatches;
        }
        if (openBraces != closeBraces) {
            mismatches.add("Mismatched braces: " + openBraces + " opening, " + closeBraces + " closing");
        }
        if (openParens != closeParens) {
            mismatches.add("Mismatched parentheses: " + openParens + " opening, " + closeParens + " closing");
        }
        if (openBrackets != closeBrackets) {
            mismatches.add("Mismatched brackets: " + openBrackets + " opening, " + closeBrackets + " closing");
        }
        return mismatches;
    }

    @Override
    public String toString() {
        if (!applicable) {
            return "BalanceReport{not applicable}";
        }
        return "BalanceReport{braces=" + openBraces + "/" + closeBraces
                + ", parens=" + openParens + "/" + closeParens
                + ", brackets=" + openBrackets + "/" + closeBrackets + "}";
    }
}
