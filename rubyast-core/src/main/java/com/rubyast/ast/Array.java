package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

import java.util.List;

public record Array(
    Loc loc,
    List<Expression> elems
) implements Expression {
    public Array {
        Enforce.notNull(loc, "Array.loc");
        elems = List.copyOf(Enforce.elementsNotNull(elems, "Array.elems"));
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Array";
    }
}
