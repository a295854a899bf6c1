package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

/** {@code &blk} */
public record BlockArg(
    Loc loc,
    Reference expr
) implements Reference {
    public BlockArg {
        Enforce.notNull(loc, "BlockArg.loc");
        Enforce.notNull(expr, "BlockArg.expr");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "BlockArg";
    }
}
