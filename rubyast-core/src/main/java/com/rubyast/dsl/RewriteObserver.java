package com.rubyast.dsl;

import com.rubyast.ast.Expression;

/**
 * Notified once for each class-body statement a rule replaced.
 */
@FunctionalInterface
public interface RewriteObserver {

    RewriteObserver NONE = (ruleName, statement, replacementCount) -> {
    };

    void onReplaced(String ruleName, Expression statement, int replacementCount);
}
