package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

public record While(
    Loc loc,
    Expression cond,
    Expression body
) implements Expression {
    public While {
        Enforce.notNull(loc, "While.loc");
        Enforce.notNull(cond, "While.cond");
        Enforce.notNull(body, "While.body");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "While";
    }
}
