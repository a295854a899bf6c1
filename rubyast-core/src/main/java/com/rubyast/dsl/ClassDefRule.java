package com.rubyast.dsl;

import com.rubyast.ast.ClassDef;
import com.rubyast.core.MutableContext;

/**
 * Rewrites a class as a whole, before its statements are scanned.
 * Returns {@code classDef} itself when it does not apply.
 */
@FunctionalInterface
public interface ClassDefRule {
    ClassDef patch(MutableContext ctx, ClassDef classDef);
}
