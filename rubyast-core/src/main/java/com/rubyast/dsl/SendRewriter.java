package com.rubyast.dsl;

import com.rubyast.ast.Expression;
import com.rubyast.ast.Send;
import com.rubyast.core.MutableContext;

/**
 * Rewrites a call anywhere in the tree, not only at class-body level.
 * Returns {@code send} itself when it does not apply.
 */
@FunctionalInterface
public interface SendRewriter {
    Expression rewrite(MutableContext ctx, Send send);
}
