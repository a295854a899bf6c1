package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;
import com.rubyast.core.NameRef;

/**
 * A variable reference before the namer has resolved it.
 */
public record UnresolvedIdent(
    Loc loc,
    Kind kind,
    NameRef name
) implements Reference {

    public enum Kind {
        LOCAL,
        INSTANCE,
        CLASS,
        GLOBAL
    }

    public UnresolvedIdent {
        Enforce.notNull(loc, "UnresolvedIdent.loc");
        Enforce.notNull(kind, "UnresolvedIdent.kind");
        Enforce.notNull(name, "UnresolvedIdent.name");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "UnresolvedIdent";
    }
}
