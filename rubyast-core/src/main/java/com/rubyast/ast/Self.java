package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;
import com.rubyast.core.SymbolRef;

public record Self(
    Loc loc,
    SymbolRef claz     // todo() until the enclosing class is known
) implements Expression {
    public Self {
        Enforce.notNull(loc, "Self.loc");
        if (claz == null) {
            claz = SymbolRef.todo();
        }
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Self";
    }
}
