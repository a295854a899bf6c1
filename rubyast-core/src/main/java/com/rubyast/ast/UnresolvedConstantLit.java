package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;
import com.rubyast.core.NameRef;

/**
 * {@code scope::Cnst} before resolution. An EmptyTree scope means "look up lexically".
 */
public record UnresolvedConstantLit(
    Loc loc,
    Expression scope,
    NameRef cnst
) implements Expression {
    public UnresolvedConstantLit {
        Enforce.notNull(loc, "UnresolvedConstantLit.loc");
        Enforce.notNull(scope, "UnresolvedConstantLit.scope");
        Enforce.check(cnst != null && cnst.exists(), "cnst.exists()", "constant without a name");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "UnresolvedConstantLit";
    }
}
