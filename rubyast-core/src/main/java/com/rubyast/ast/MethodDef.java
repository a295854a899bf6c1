package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;
import com.rubyast.core.NameRef;
import com.rubyast.core.SymbolRef;

import java.util.List;

public record MethodDef(
    Loc loc,
    Loc declLoc,
    SymbolRef symbol,
    NameRef name,
    List<Expression> args,    // Reference variants, in call-site order
    Expression rhs,
    int flags
) implements Declaration {

    /** {@code def self.foo} */
    public static final int SELF_METHOD = 1;
    /** Produced by a DSL rewrite rather than written in source. */
    public static final int DSL_SYNTHESIZED = 2;

    private static final int ALL_FLAGS = SELF_METHOD | DSL_SYNTHESIZED;

    public MethodDef {
        Enforce.notNull(loc, "MethodDef.loc");
        Enforce.notNull(name, "MethodDef.name");
        Enforce.notNull(rhs, "MethodDef.rhs");
        args = List.copyOf(Enforce.elementsNotNull(args, "MethodDef.args"));
        for (Expression arg : args) {
            Enforce.check(arg instanceof Reference, "arg instanceof Reference",
                "MethodDef argument is a ", arg.type());
        }
        Enforce.check((flags & ~ALL_FLAGS) == 0, "(flags & ~ALL_FLAGS) == 0", "unknown flag bits ", flags);
        if (declLoc == null) {
            declLoc = loc;
        }
        if (symbol == null) {
            symbol = SymbolRef.todo();
        }
    }

    public MethodDef(Loc loc, NameRef name, List<Expression> args, Expression rhs, int flags) {
        this(loc, loc, SymbolRef.todo(), name, args, rhs, flags);
    }

    public boolean isSelf() {
        return (flags & SELF_METHOD) != 0;
    }

    public boolean isDSLSynthesized() {
        return (flags & DSL_SYNTHESIZED) != 0;
    }

    public MethodDef withRhs(Expression newRhs) {
        return new MethodDef(loc, declLoc, symbol, name, args, newRhs, flags);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "MethodDef";
    }
}
