package me.christianrobert.retarget.translator.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.TargetLanguage;
import me.christianrobert.retarget.translator.profile.WrapperStrategy;

/**
 * Writes the "generated by" banner placed on top of translated programs.
 *
 * <p>Example for Go:
 * <pre>
 * // ========================================
 * // Tool: retarget
 * // Source: Python
 * // Target: Go
 * // ========================================
 * </pre>
 *
 * <p>Script-tag targets keep their opening tag on the first line, so the banner goes
 * right after it.</p>
 */
@ApplicationScoped
public class GeneratedHeaderWriter {

    static final String RULE = "========================================";
    static final String SOURCE_LANGUAGE = "Python";

    public String header(TargetLanguage language, String toolName) {
        String token = language.getCommentToken();
        StringBuilder sb = new StringBuilder();
        sb.append(token).append(' ').append(RULE).append('\n');
        sb.append(token).append(" Tool: ").append(toolName).append('\n');
        sb.append(token).append(" Source: ").append(SOURCE_LANGUAGE).append('\n');
        sb.append(token).append(" Target: ").append(language.getDisplayName()).append('\n');
        sb.append(token).append(' ').append(RULE);
        return sb.toString();
    }

    public String prepend(String code, LanguageProfile profile, String toolName) {
        String header = header(profile.getLanguage(), toolName);
        if (profile.getWrapperStrategy() == WrapperStrategy.SCRIPT_TAG) {
            int firstBreak = code.indexOf('\n');
            if (firstBreak >= 0) {
                return code.substring(0, firstBreak + 1) + header + "\n" + code.substring(firstBreak + 1);
            }
            return code + "\n" + header;
        }
        return header + "\n\n" + code;
    }
}
