package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

/** Block-local variable declared after {@code ;} in the block parameter list. */
public record ShadowArg(
    Loc loc,
    Reference expr
) implements Reference {
    public ShadowArg {
        Enforce.notNull(loc, "ShadowArg.loc");
        Enforce.notNull(expr, "ShadowArg.expr");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "ShadowArg";
    }
}
