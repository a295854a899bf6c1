package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;
import com.rubyast.core.Loc;

import java.util.List;

/**
 * A hash literal; {@code keys.get(i)} maps to {@code values.get(i)}.
 */
public record Hash(
    Loc loc,
    List<Expression> keys,
    List<Expression> values
) implements Expression {
    public Hash {
        Enforce.notNull(loc, "Hash.loc");
        keys = List.copyOf(Enforce.elementsNotNull(keys, "Hash.keys"));
        values = List.copyOf(Enforce.elementsNotNull(values, "Hash.values"));
        Enforce.check(keys.size() == values.size(), "keys.size() == values.size()",
            keys.size(), " keys but ", values.size(), " values");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String type() {
        return "Hash";
    }
}
