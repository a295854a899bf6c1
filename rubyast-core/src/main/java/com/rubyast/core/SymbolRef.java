package com.rubyast.core;

/**
 * Non-owning handle to a class, method or field symbol in the external symbol table.
 *
 * Id 0 is "no symbol"; id 1 is the "todo" symbol that producers attach to
 * definitions before the namer has entered them.
 */
public record SymbolRef(int id) {
    private static final SymbolRef NO_SYMBOL = new SymbolRef(0);
    private static final SymbolRef TODO = new SymbolRef(1);

    public static SymbolRef noSymbol() {
        return NO_SYMBOL;
    }

    public static SymbolRef todo() {
        return TODO;
    }

    public boolean exists() {
        return id != 0;
    }

    public String showName(GlobalState gs) {
        if (!exists()) {
            return "<none>";
        }
        if (this.equals(TODO)) {
            return "<todo sym>";
        }
        return gs.symbolName(this);
    }

    public String showFullName(GlobalState gs) {
        if (!exists()) {
            return "<none>";
        }
        if (this.equals(TODO)) {
            return "<todo sym>";
        }
        return gs.symbolFullName(this);
    }
}
