package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

import java.util.List;

public record Rescue(
    Loc loc,
    Expression body,
    List<RescueCase> rescueCases,
    Expression elseBranch,   // EmptyTree when absent
    Expression ensure        // EmptyTree when absent
) implements Expression {
    public Rescue {
        Enforce.notNull(loc, "Rescue.loc");
        Enforce.notNull(body, "Rescue.body");
        rescueCases = List.copyOf(Enforce.elementsNotNull(rescueCases, "Rescue.rescueCases"));
        Enforce.notNull(elseBranch, "Rescue.elseBranch");
        Enforce.notNull(ensure, "Rescue.ensure");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Rescue";
    }
}
