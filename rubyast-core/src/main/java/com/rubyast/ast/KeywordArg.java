package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

/** {@code name:} */
public record KeywordArg(
    Loc loc,
    Reference expr
) implements Reference {
    public KeywordArg {
        Enforce.notNull(loc, "KeywordArg.loc");
        Enforce.notNull(expr, "KeywordArg.expr");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "KeywordArg";
    }
}
