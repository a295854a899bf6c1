package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;
import com.rubyast.core.SymbolRef;

import java.util.List;

public record ClassDef(
    Loc loc,
    Loc declLoc,
    SymbolRef symbol,
    ClassDefKind kind,
    Expression name,          // UnresolvedConstantLit or ConstantLit
    List<Expression> ancestors,
    List<Expression> rhs      // class body statements, in source order
) implements Declaration {
    public ClassDef {
        Enforce.notNull(loc, "ClassDef.loc");
        Enforce.notNull(kind, "ClassDef.kind");
        Enforce.notNull(name, "ClassDef.name");
        ancestors = List.copyOf(Enforce.elementsNotNull(ancestors, "ClassDef.ancestors"));
        rhs = List.copyOf(Enforce.elementsNotNull(rhs, "ClassDef.rhs"));
        if (declLoc == null) {
            declLoc = loc;
        }
        if (symbol == null) {
            symbol = SymbolRef.todo();
        }
    }

    public ClassDef withRhs(List<Expression> newRhs) {
        return new ClassDef(loc, declLoc, symbol, kind, name, ancestors, newRhs);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "ClassDef";
    }
}
