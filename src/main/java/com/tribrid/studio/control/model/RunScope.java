package com.tribrid.studio.control.model;

/**
 * Which runs a listing covers.
 */
public enum RunScope {

    CORPUS("corpus"),
    ALL("all");

    private final String wireName;

    RunScope(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static RunScope fromParam(String value) {
        if (value == null || value.isBlank()) {
            return CORPUS;
        }
        for (RunScope scope : values()) {
            if (scope.wireName.equalsIgnoreCase(value.trim())) {
                return scope;
            }
        }
        throw new IllegalArgumentException("scope must be 'corpus' or 'all', got: " + value);
    }
}
