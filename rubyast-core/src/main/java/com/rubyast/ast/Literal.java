package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

public record Literal(
    Loc loc,
    LiteralValue value
) implements Expression {
    public Literal {
        Enforce.notNull(loc, "Literal.loc");
        Enforce.notNull(value, "Literal.value");
    }

    public boolean isSymbol() {
        return value instanceof LiteralValue.SymbolValue;
    }

    public boolean isString() {
        return value instanceof LiteralValue.StringValue;
    }

    public boolean isNil() {
        return value instanceof LiteralValue.NilValue;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Literal";
    }
}
