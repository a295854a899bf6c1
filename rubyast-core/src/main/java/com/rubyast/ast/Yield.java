package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

import java.util.List;

public record Yield(
    Loc loc,
    List<Expression> args
) implements Expression {
    public Yield {
        Enforce.notNull(loc, "Yield.loc");
        args = List.copyOf(Enforce.elementsNotNull(args, "Yield.args"));
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Yield";
    }
}
