package me.christianrobert.retarget.translator.profile;

import java.util.HashMap;
import java.util.Map;

/**
 * Origin builtins that every profile rewrites structurally.
 */
public enum Builtin {
    PRINT("print"),
    LEN("len"),
    STR("str"),
    RANGE("range");

    private static final Map<String, Builtin> BY_NAME = new HashMap<>();

    static {
        for (Builtin builtin : values()) {
            BY_NAME.put(builtin.originName, builtin);
        }
    }

    private final String originName;

    Builtin(String originName) {
        this.originName = originName;
    }

    public String getOriginName() {
        return originName;
    }

    /**
     * @return the builtin called {@code name}, or null for any other callee
     */
    public static Builtin fromName(String name) {
        return BY_NAME.get(name);
    }
}
