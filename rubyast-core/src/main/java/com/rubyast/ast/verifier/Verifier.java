package com.rubyast.ast.verifier;

import com.rubyast.ast.ConstantLit;
import com.rubyast.ast.EmptyTree;
import com.rubyast.ast.Expression;
import com.rubyast.ast.visitor.Children;
import com.rubyast.common.Enforce;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Checks that a tree is well owned: every node instance is reachable exactly once
 * ({@link EmptyTree} may be shared), counting {@link ConstantLit#original()} as owned;
 * no child slot is null and every node other than EmptyTree carries a real source
 * location.
 *
 * Run it after a rewrite pass; a failure means a rule reused an input subtree without
 * copying it or built a node from thin air.
 */
public final class Verifier {

    private Verifier() {
    }

    /**
     * Returns {@code tree} so calls can be chained.
     */
    public static <T extends Expression> T run(T tree) {
        Enforce.notNull(tree, "tree");
        Set<Expression> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Expression> pending = new ArrayDeque<>();
        pending.push(tree);
        while (!pending.isEmpty()) {
            Expression node = pending.pop();
            if (node instanceof EmptyTree) {
                continue;
            }
            Enforce.check(seen.add(node), "seen.add(node)", "node is reachable twice: ", node.type());
            Enforce.check(node.loc().exists(), "node.loc().exists()", node.type(), " has no location");
            for (Expression child : Children.of(node)) {
                Enforce.check(child != null, "child != null", "null child in ", node.type());
                pending.push(child);
            }
            // Not a child, but still owned by the constant.
            if (node instanceof ConstantLit && ((ConstantLit) node).original() != null) {
                pending.push(((ConstantLit) node).original());
            }
        }
        return tree;
    }
}
