package com.rubyast.dsl.rules;

import com.rubyast.ast.Expression;
import com.rubyast.ast.Nodes;
import com.rubyast.ast.Send;
import com.rubyast.core.Loc;
import com.rubyast.core.MutableContext;
import com.rubyast.core.NameRef;
import com.rubyast.dsl.StatementRule;

import java.util.List;

/**
 * Builder-style class DSL:
 *
 * <pre>
 * dsl_optional :foo, String  =>  def self.foo(foo); self; end
 *                                def get_foo; T.let(@foo, String); end
 * </pre>
 *
 * {@code dsl_required} expands the same way.
 */
public final class DSLBuilder implements StatementRule<Send> {

    @Override
    public List<Expression> replace(MutableContext ctx, Send send, Expression prevStat) {
        if (!RuleSupport.isSelfCall(ctx, send, "dsl_optional") && !RuleSupport.isSelfCall(ctx, send, "dsl_required")) {
            return List.of();
        }
        if (send.args().size() < 2) {
            return List.of();
        }
        NameRef name = RuleSupport.symbolArg(send.args().get(0));
        if (name == null) {
            return List.of();
        }

        Loc loc = send.loc();
        String text = RuleSupport.text(ctx, name);
        // The call is dropped, so its type argument can move into the getter.
        Expression type = send.args().get(1);

        Expression builder = Nodes.method1(loc, name, Nodes.localIdent(loc, name), Nodes.self(loc),
            RuleSupport.SELF_SYNTHESIZED);
        Expression getter = RuleSupport.reader(loc, ctx.name("get_" + text),
            RuleSupport.tLet(ctx, loc, RuleSupport.instanceVar(ctx, loc, text), type));
        return List.of(builder, getter);
    }
}
