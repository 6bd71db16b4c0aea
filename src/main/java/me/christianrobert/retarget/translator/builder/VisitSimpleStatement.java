package me.christianrobert.retarget.translator.builder;

import me.christianrobert.retarget.translator.profile.LanguageProfile;

/**
 * Keyword-only statements: pass, break and continue.
 */
public class VisitSimpleStatement {

    public static String pass(TargetCodeBuilder b) {
        return b.getContext().indent() + b.getProfile().noOpStatement();
    }

    public static String breakLoop(TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        return b.getContext().indent() + profile.getBreakKeyword() + profile.getTerminator();
    }

    public static String continueLoop(TargetCodeBuilder b) {
        LanguageProfile profile = b.getProfile();
        return b.getContext().indent() + profile.getContinueKeyword() + profile.getTerminator();
    }
}
