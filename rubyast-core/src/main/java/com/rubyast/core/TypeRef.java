package com.rubyast.core;

/**
 * Handle to a type owned by the external type table (used by {@code Cast}).
 */
public record TypeRef(int id) {
    public String show(GlobalState gs) {
        return gs.typeToString(this);
    }
}
