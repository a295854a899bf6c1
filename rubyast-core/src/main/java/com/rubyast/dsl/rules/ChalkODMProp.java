package com.rubyast.dsl.rules;

import com.rubyast.ast.Expression;
import com.rubyast.ast.Send;
import com.rubyast.core.Loc;
import com.rubyast.core.MutableContext;
import com.rubyast.core.NameRef;
import com.rubyast.dsl.StatementRule;

import java.util.List;

/**
 * Chalk ODM properties:
 *
 * <pre>
 * prop :foo, String     =>  def foo; @foo; end
 *                           def foo=(foo); @foo = foo; end
 * const :foo, String    =>  def foo; @foo; end
 * </pre>
 *
 * An optional third argument (the options hash) is accepted and ignored.
 */
public final class ChalkODMProp implements StatementRule<Send> {

    @Override
    public List<Expression> replace(MutableContext ctx, Send send, Expression prevStat) {
        boolean isConst = RuleSupport.isSelfCall(ctx, send, "const");
        if (!isConst && !RuleSupport.isSelfCall(ctx, send, "prop")) {
            return List.of();
        }
        if (send.args().size() < 2 || send.args().size() > 3) {
            return List.of();
        }
        NameRef name = RuleSupport.symbolArg(send.args().get(0));
        if (name == null) {
            return List.of();
        }

        Loc loc = send.loc();
        String text = RuleSupport.text(ctx, name);
        Expression getter = RuleSupport.reader(loc, name, RuleSupport.instanceVar(ctx, loc, text));
        if (isConst) {
            return List.of(getter);
        }
        return List.of(getter, RuleSupport.writer(ctx, loc, text, text));
    }
}
