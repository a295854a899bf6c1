package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.core.Loc;

/**
 * The "no expression here" value. Used for every absent child so that no slot is ever null.
 */
public record EmptyTree() implements Expression {

    @Override
    public Loc loc() {
        return Loc.none();
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "EmptyTree";
    }
}
