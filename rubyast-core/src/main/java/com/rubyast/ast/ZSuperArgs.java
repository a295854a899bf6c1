package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

/**
 * Stands for the implicit argument list of a bare {@code super}.
 */
public record ZSuperArgs(Loc loc) implements Expression {
    public ZSuperArgs {
        Enforce.notNull(loc, "ZSuperArgs.loc");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "ZSuperArgs";
    }
}
