package com.rubyast.dsl;

import com.rubyast.ast.Expression;
import com.rubyast.core.MutableContext;

import java.util.List;

/**
 * A rewrite of one class-body statement.
 *
 * @param <T> the statement variant this rule inspects
 */
@FunctionalInterface
public interface StatementRule<T extends Expression> {

    /**
     * Returns the statements that replace {@code stat}, or an empty list when the rule
     * does not apply. {@code prevStat} is the statement before {@code stat} as it was
     * written (not rewritten), or an {@link com.rubyast.ast.EmptyTree} for the first one.
     * A matched {@code stat} is dropped from the tree, so it and its subtrees may be
     * moved into the result once each. {@code prevStat} stays in place; anything taken
     * from it is copied with {@link com.rubyast.ast.visitor.DeepCopier}.
     */
    List<Expression> replace(MutableContext ctx, T stat, Expression prevStat);
}
