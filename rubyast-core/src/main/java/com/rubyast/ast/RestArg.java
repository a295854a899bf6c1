package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

/** {@code *args} */
public record RestArg(
    Loc loc,
    Reference expr
) implements Reference {
    public RestArg {
        Enforce.notNull(loc, "RestArg.loc");
        Enforce.notNull(expr, "RestArg.expr");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "RestArg";
    }
}
