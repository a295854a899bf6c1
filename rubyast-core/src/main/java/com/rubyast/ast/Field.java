package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;
import com.rubyast.core.SymbolRef;

/**
 * A resolved instance, class or global variable.
 */
public record Field(
    Loc loc,
    SymbolRef symbol
) implements Reference {
    public Field {
        Enforce.notNull(loc, "Field.loc");
        Enforce.notNull(symbol, "Field.symbol");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Field";
    }
}
