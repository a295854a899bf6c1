package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

public record Assign(
    Loc loc,
    Expression lhs,
    Expression rhs
) implements Expression {
    public Assign {
        Enforce.notNull(loc, "Assign.loc");
        Enforce.notNull(lhs, "Assign.lhs");
        Enforce.notNull(rhs, "Assign.rhs");
        Enforce.check(lhs instanceof Reference || lhs instanceof UnresolvedConstantLit || lhs instanceof ConstantLit,
            "lhs is assignable", "cannot assign to a ", lhs.type());
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Assign";
    }
}
