package com.rubyast.core;

/**
 * Non-owning handle to an interned name in the external name table.
 * Two handles are equal exactly when they name the same entry.
 */
public record NameRef(int id) {
    private static final NameRef NO_NAME = new NameRef(0);

    public static NameRef noName() {
        return NO_NAME;
    }

    public boolean exists() {
        return id != 0;
    }

    public String show(GlobalState gs) {
        if (!exists()) {
            return "<none>";
        }
        return gs.nameText(this);
    }
}
