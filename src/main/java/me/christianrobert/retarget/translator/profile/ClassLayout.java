package me.christianrobert.retarget.translator.profile;

/**
 * How class definitions are rendered.
 */
public enum ClassLayout {
    /** Members nested inside a class block. */
    NESTED,
    /** Struct-like declaration for the fields, methods as separate functions bound to it. */
    DETACHED
}
