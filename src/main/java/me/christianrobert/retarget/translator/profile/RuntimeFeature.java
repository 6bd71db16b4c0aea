package me.christianrobert.retarget.translator.profile;

/**
 * Target runtime facilities an emission used; keys the import lines a profile declares.
 */
public enum RuntimeFeature {
    PRINT,
    LEN,
    STR,
    RANGE,
    LIST,
    TUPLE,
    DICT,
    POW;

    public static RuntimeFeature of(Builtin builtin) {
        return valueOf(builtin.name());
    }
}
