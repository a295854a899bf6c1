package com.rubyast.dsl;

import com.rubyast.ast.Expression;
import com.rubyast.ast.treemap.TreeMap;
import com.rubyast.core.MutableContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the desugaring pass.
 */
public final class DSL {

    private static final Logger LOGGER = LoggerFactory.getLogger(DSL.class);

    private DSL() {
    }

    public static Expression run(MutableContext ctx, Expression tree) {
        return run(ctx, tree, DslRuleSet.standard(), RewriteObserver.NONE);
    }

    /**
     * Rewrites {@code tree} bottom-up, so nested classes are processed before the
     * classes that contain them.
     */
    public static Expression run(MutableContext ctx, Expression tree, DslRuleSet rules, RewriteObserver observer) {
        LOGGER.trace("Running DSL pass on {} in file {}", tree.type(), ctx.file());
        Expression result = TreeMap.apply(ctx, new DSLReplacer(rules, observer), tree);
        LOGGER.trace("DSL pass done, {} diagnostic(s) so far", ctx.errors().size());
        return result;
    }
}
