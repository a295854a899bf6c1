package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;
import com.rubyast.core.NameRef;

import java.util.List;

/**
 * A method call {@code recv.fun(args) { block }}.
 */
public record Send(
    Loc loc,
    Expression recv,        // a Self node for calls with an implicit receiver
    NameRef fun,
    List<Expression> args,
    Block block             // Can be null
) implements Expression {
    public Send {
        Enforce.notNull(loc, "Send.loc");
        Enforce.notNull(recv, "Send.recv");
        Enforce.check(fun != null && fun.exists(), "fun.exists()", "Send without a method name");
        args = List.copyOf(Enforce.elementsNotNull(args, "Send.args"));
    }

    public Send(Loc loc, Expression recv, NameRef fun, List<Expression> args) {
        this(loc, recv, fun, args, null);
    }

    public boolean hasBlock() {
        return block != null;
    }

    public Send withBlock(Block newBlock) {
        return new Send(loc, recv, fun, args, newBlock);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Send";
    }
}
