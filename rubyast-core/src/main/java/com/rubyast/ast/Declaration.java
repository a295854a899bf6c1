package com.rubyast.ast;

import com.rubyast.core.Loc;
import com.rubyast.core.SymbolRef;

/**
 * Class, module and method definitions.
 */
public sealed interface Declaration extends Expression permits ClassDef, MethodDef {

    /**
     * Location of the declaration header only (e.g. {@code class Foo < Bar}).
     */
    Loc declLoc();

    SymbolRef symbol();
}
