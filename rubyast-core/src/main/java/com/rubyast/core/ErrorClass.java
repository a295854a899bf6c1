package com.rubyast.core;

/**
 * Identifies a family of user-facing diagnostics. Each pass declares its own constants.
 */
public record ErrorClass(int code, String name) {
    @Override
    public String toString() {
        return name + "(" + code + ")";
    }
}
