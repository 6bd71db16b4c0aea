package me.christianrobert.retarget.translator.profile;

/**
 * Whole-program packaging a target requires around the translated statements.
 */
public enum WrapperStrategy {
    /** Statements are emitted as they are. */
    NONE,
    /** One enclosing class: definitions become members, bare statements go to a synthesized entry point. */
    SINGLE_CLASS_WITH_MAIN,
    /** Fixed prologue, top-level definitions, then a synthesized main function with the bare statements. */
    PACKAGE_MAIN_FUNC,
    /** Fixed opening and closing tag around the whole body. */
    SCRIPT_TAG
}
