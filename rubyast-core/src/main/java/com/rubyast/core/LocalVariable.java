package com.rubyast.core;

/**
 * A resolved local variable: its source name plus a disambiguating counter
 * (0 for the first variable of that name in a method).
 */
public record LocalVariable(NameRef name, int unique) {
    public LocalVariable {
        if (name == null) {
            name = NameRef.noName();
        }
    }

    public String show(GlobalState gs) {
        if (unique == 0) {
            return name.show(gs);
        }
        return name.show(gs) + "$" + unique;
    }
}
