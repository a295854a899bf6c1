package com.rubyast.dsl.rules;

import com.rubyast.ast.Expression;
import com.rubyast.ast.Nodes;
import com.rubyast.ast.Send;
import com.rubyast.core.MutableContext;
import com.rubyast.dsl.DslErrors;
import com.rubyast.dsl.SendRewriter;

/**
 * {@code Foo.wrap_instance(x)} becomes {@code T.cast(x, Foo)}. Calls with a block are left alone.
 */
public final class InterfaceWrapper implements SendRewriter {

    @Override
    public Expression rewrite(MutableContext ctx, Send send) {
        if (!RuleSupport.hasName(ctx, send.fun(), "wrap_instance") || !RuleSupport.isConstantLike(send.recv())
            || send.block() != null) {
            return send;
        }
        if (send.args().size() != 1) {
            ctx.reportError(send.loc(), DslErrors.BAD_WRAP_INSTANCE,
                "Wrong number of arguments to `wrap_instance`. Expected: `1`, got: `" + send.args().size() + "`");
            return send;
        }
        return Nodes.send2(send.loc(), Nodes.constant(send.loc(), ctx.name("T")), ctx.name("cast"),
            send.args().get(0), send.recv());
    }
}
