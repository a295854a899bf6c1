package com.rubyast.core;

/**
 * Handle to a source file owned by the external file table.
 */
public record FileRef(int id) {
    private static final FileRef NONE = new FileRef(0);

    public static FileRef none() {
        return NONE;
    }

    public boolean exists() {
        return id != 0;
    }
}
