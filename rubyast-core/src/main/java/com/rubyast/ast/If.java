package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

public record If(
    Loc loc,
    Expression cond,
    Expression thenp,
    Expression elsep   // EmptyTree when there is no else branch
) implements Expression {
    public If {
        Enforce.notNull(loc, "If.loc");
        Enforce.notNull(cond, "If.cond");
        Enforce.notNull(thenp, "If.thenp");
        Enforce.notNull(elsep, "If.elsep");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "If";
    }
}
