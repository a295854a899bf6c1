package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;
import com.rubyast.core.SymbolRef;

/**
 * A constant reference after resolution.
 *
 * <p>Exactly one form is authoritative: the resolved {@code symbol}, or the
 * {@code typeAlias} target, or (when resolution failed) the {@code original}
 * unresolved literal.</p>
 */
public record ConstantLit(
    Loc loc,
    SymbolRef symbol,                   // noSymbol() or todo() unless resolved to a symbol
    UnresolvedConstantLit original,     // Can be null
    Expression typeAlias                // EmptyTree unless resolved to a type alias
) implements Expression {
    public ConstantLit {
        Enforce.notNull(loc, "ConstantLit.loc");
        if (symbol == null) {
            symbol = SymbolRef.noSymbol();
        }
        if (typeAlias == null) {
            typeAlias = new EmptyTree();
        }
        boolean resolved = isResolved(symbol);
        boolean hasAlias = !(typeAlias instanceof EmptyTree);
        Enforce.check(!(resolved && hasAlias), "!(resolved && hasAlias)",
            "a constant resolves to a symbol or to a type alias, not both");
        Enforce.check(resolved || hasAlias || original != null,
            "resolved || hasAlias || original != null", "unresolved constant lost its original");
    }

    /**
     * {@code todo()} is a placeholder, not a resolution.
     */
    private static boolean isResolved(SymbolRef symbol) {
        return symbol.exists() && !symbol.equals(SymbolRef.todo());
    }

    public Kind resolution() {
        if (isResolved(symbol)) {
            return Kind.SYMBOL;
        }
        if (!(typeAlias instanceof EmptyTree)) {
            return Kind.TYPE_ALIAS;
        }
        return Kind.UNRESOLVED;
    }

    public enum Kind {
        SYMBOL,
        TYPE_ALIAS,
        UNRESOLVED
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "ConstantLit";
    }
}
