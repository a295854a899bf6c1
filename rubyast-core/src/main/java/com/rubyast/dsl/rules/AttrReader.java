package com.rubyast.dsl.rules;

import com.rubyast.ast.Expression;
import com.rubyast.ast.Send;
import com.rubyast.ast.visitor.DeepCopier;
import com.rubyast.core.Loc;
import com.rubyast.core.MutableContext;
import com.rubyast.core.NameRef;
import com.rubyast.dsl.DslErrors;
import com.rubyast.dsl.StatementRule;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code attr_reader}, {@code attr_writer} and {@code attr_accessor}.
 *
 * <p>Readers return the instance variable. When the statement right before is a
 * {@code sig { returns(Type) }}, readers return {@code T.let(@ivar, Type)} instead so the
 * declared type is kept.</p>
 */
public final class AttrReader implements StatementRule<Send> {

    @Override
    public List<Expression> replace(MutableContext ctx, Send send, Expression prevStat) {
        boolean makeReader = false;
        boolean makeWriter = false;
        if (RuleSupport.isSelfCall(ctx, send, "attr_reader")) {
            makeReader = true;
        } else if (RuleSupport.isSelfCall(ctx, send, "attr_writer")) {
            makeWriter = true;
        } else if (RuleSupport.isSelfCall(ctx, send, "attr_accessor")) {
            makeReader = true;
            makeWriter = true;
        } else {
            return List.of();
        }

        Expression sigType = makeReader ? sigReturnType(ctx, prevStat) : null;
        List<Expression> result = new ArrayList<>();
        for (Expression arg : send.args()) {
            NameRef name = RuleSupport.symbolOrStringArg(arg);
            if (name == null) {
                ctx.reportError(arg.loc(), DslErrors.BAD_ATTR_ARG,
                    "Argument to `" + RuleSupport.text(ctx, send.fun()) + "` must be a Symbol or String");
                continue;
            }
            Loc loc = arg.loc();
            String text = RuleSupport.text(ctx, name);
            if (makeReader) {
                Expression body = RuleSupport.instanceVar(ctx, loc, text);
                if (sigType != null) {
                    body = RuleSupport.tLet(ctx, loc, body, DeepCopier.copy(sigType));
                }
                result.add(RuleSupport.reader(loc, name, body));
            }
            if (makeWriter) {
                result.add(RuleSupport.writer(ctx, loc, text, text));
            }
        }
        return result;
    }

    /**
     * Returns {@code Type} when {@code prevStat} is {@code sig { returns(Type) }}, else null.
     * The result still belongs to {@code prevStat}.
     */
    private static Expression sigReturnType(MutableContext ctx, Expression prevStat) {
        if (!(prevStat instanceof Send)) {
            return null;
        }
        Send sig = (Send) prevStat;
        if (!RuleSupport.isSelfCall(ctx, sig, "sig") || sig.block() == null) {
            return null;
        }
        if (!(sig.block().body() instanceof Send)) {
            return null;
        }
        Send returns = (Send) sig.block().body();
        if (!RuleSupport.hasName(ctx, returns.fun(), "returns") || returns.args().size() != 1) {
            return null;
        }
        return returns.args().get(0);
    }
}
