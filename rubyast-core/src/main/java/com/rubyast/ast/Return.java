package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

public record Return(
    Loc loc,
    Expression expr   // EmptyTree when no value is given
) implements Expression {
    public Return {
        Enforce.notNull(loc, "Return.loc");
        Enforce.notNull(expr, "Return.expr");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Return";
    }
}
