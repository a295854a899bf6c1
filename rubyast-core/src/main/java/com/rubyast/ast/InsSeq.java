package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

import java.util.List;

/**
 * A statement sequence whose value is {@code expr}.
 */
public record InsSeq(
    Loc loc,
    List<Expression> stats,
    Expression expr
) implements Expression {
    public InsSeq {
        Enforce.notNull(loc, "InsSeq.loc");
        stats = List.copyOf(Enforce.elementsNotNull(stats, "InsSeq.stats"));
        Enforce.notNull(expr, "InsSeq.expr");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "InsSeq";
    }
}
