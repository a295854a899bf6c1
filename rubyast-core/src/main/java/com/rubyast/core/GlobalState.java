package com.rubyast.core;

/**
 * The view of the external, append-only symbol table that trees and rewrite rules need.
 *
 * <p>Trees only ever hold {@link NameRef}, {@link SymbolRef} and {@link TypeRef} handles;
 * everything those handles point at lives behind this interface.</p>
 */
public interface GlobalState {

    /**
     * Returns the text of an interned name.
     */
    String nameText(NameRef name);

    /**
     * Interns {@code text}, returning the existing handle when it was entered before.
     */
    NameRef enterName(String text);

    /**
     * Returns the short name of a symbol, e.g. {@code Command}.
     */
    String symbolName(SymbolRef symbol);

    /**
     * Returns the fully qualified name of a symbol, e.g. {@code Opus::Command}.
     */
    String symbolFullName(SymbolRef symbol);

    /**
     * Whether {@code symbol} was entered into the table. Sentinels never exist.
     */
    boolean symbolExists(SymbolRef symbol);

    String typeToString(TypeRef type);
}
