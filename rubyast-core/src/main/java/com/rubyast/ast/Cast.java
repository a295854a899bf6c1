package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;
import com.rubyast.core.NameRef;
import com.rubyast.core.TypeRef;

/**
 * {@code T.let}, {@code T.cast} and friends once the type argument has been resolved.
 */
public record Cast(
    Loc loc,
    TypeRef castType,
    Expression arg,
    NameRef cast       // which of let / cast / assert_type! was written
) implements Expression {
    public Cast {
        Enforce.notNull(loc, "Cast.loc");
        Enforce.notNull(castType, "Cast.castType");
        Enforce.notNull(arg, "Cast.arg");
        Enforce.notNull(cast, "Cast.cast");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Cast";
    }
}
