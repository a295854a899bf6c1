package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;
import com.rubyast.core.SymbolRef;

import java.util.List;

/**
 * The {@code do |args| body end} attached to a {@link Send}.
 */
public record Block(
    Loc loc,
    List<Expression> args,   // Reference variants
    Expression body,
    SymbolRef symbol         // noSymbol() until the resolver fills it in
) implements Expression {
    public Block {
        Enforce.notNull(loc, "Block.loc");
        args = List.copyOf(Enforce.elementsNotNull(args, "Block.args"));
        for (Expression arg : args) {
            Enforce.check(arg instanceof Reference, "arg instanceof Reference",
                "Block argument is a ", arg.type());
        }
        Enforce.notNull(body, "Block.body");
        if (symbol == null) {
            symbol = SymbolRef.noSymbol();
        }
    }

    public Block(Loc loc, List<Expression> args, Expression body) {
        this(loc, args, body, SymbolRef.noSymbol());
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Block";
    }
}
