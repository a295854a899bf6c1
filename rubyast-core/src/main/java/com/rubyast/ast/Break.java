package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

public record Break(
    Loc loc,
    Expression expr   // EmptyTree when no value is given
) implements Expression {
    public Break {
        Enforce.notNull(loc, "Break.loc");
        Enforce.notNull(expr, "Break.expr");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Break";
    }
}
