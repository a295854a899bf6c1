package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

import java.util.List;

public record RescueCase(
    Loc loc,
    List<Expression> exceptions,  // empty for a bare rescue
    Expression var,               // the "=> e" binding, EmptyTree when absent
    Expression body
) implements Expression {
    public RescueCase {
        Enforce.notNull(loc, "RescueCase.loc");
        exceptions = List.copyOf(Enforce.elementsNotNull(exceptions, "RescueCase.exceptions"));
        Enforce.notNull(var, "RescueCase.var");
        Enforce.notNull(body, "RescueCase.body");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "RescueCase";
    }
}
