package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;
import com.rubyast.core.LocalVariable;

public record Local(
    Loc loc,
    LocalVariable localVariable
) implements Reference {
    public Local {
        Enforce.notNull(loc, "Local.loc");
        Enforce.notNull(localVariable, "Local.localVariable");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Local";
    }
}
