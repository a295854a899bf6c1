package com.rubyast.core;

/**
 * A span of source text: byte offsets into a file.
 * A node's Loc is fixed when the node is built.
 */
public record Loc(
    FileRef file,
    int beginPos,
    int endPos
) {
    private static final Loc NONE = new Loc(FileRef.none(), 0, 0);

    public Loc {
        if (file == null) {
            file = FileRef.none();
        }
    }

    public static Loc none() {
        return NONE;
    }

    public static Loc none(FileRef file) {
        return new Loc(file, 0, 0);
    }

    public boolean exists() {
        return file.exists();
    }
}
