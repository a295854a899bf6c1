package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

/** {@code name = default} */
public record OptionalArg(
    Loc loc,
    Reference expr,
    Expression defaultValue
) implements Reference {
    public OptionalArg {
        Enforce.notNull(loc, "OptionalArg.loc");
        Enforce.notNull(expr, "OptionalArg.expr");
        Enforce.notNull(defaultValue, "OptionalArg.defaultValue");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "OptionalArg";
    }
}
