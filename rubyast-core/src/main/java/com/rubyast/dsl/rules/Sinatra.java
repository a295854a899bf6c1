package com.rubyast.dsl.rules;

import com.rubyast.ast.Expression;
import com.rubyast.ast.InsSeq;
import com.rubyast.ast.MethodDef;
import com.rubyast.ast.Nodes;
import com.rubyast.ast.Send;
import com.rubyast.ast.UnresolvedIdent;
import com.rubyast.ast.visitor.DeepCopier;
import com.rubyast.core.MutableContext;
import com.rubyast.dsl.StatementRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Sinatra extensions register helper modules from {@code self.registered}:
 *
 * <pre>
 * def self.registered(app)        def self.registered(app)
 *   app.helpers(Helpers)     =>      app.helpers(Helpers)
 * end                              end
 *                                  include Helpers
 * </pre>
 *
 * so that the helper methods are visible on the extension.
 */
public final class Sinatra implements StatementRule<MethodDef> {

    @Override
    public List<Expression> replace(MutableContext ctx, MethodDef mdef, Expression prevStat) {
        if (!mdef.isSelf() || !RuleSupport.hasName(ctx, mdef.name(), "registered") || mdef.args().size() != 1) {
            return List.of();
        }
        if (!(mdef.args().get(0) instanceof UnresolvedIdent)) {
            return List.of();
        }
        UnresolvedIdent app = (UnresolvedIdent) mdef.args().get(0);

        List<Expression> stats = new ArrayList<>();
        if (mdef.rhs() instanceof InsSeq) {
            InsSeq seq = (InsSeq) mdef.rhs();
            stats.addAll(seq.stats());
            stats.add(seq.expr());
        } else {
            stats.add(mdef.rhs());
        }

        List<Expression> result = new ArrayList<>();
        for (Expression stat : stats) {
            if (!(stat instanceof Send)) {
                continue;
            }
            Send send = (Send) stat;
            if (!RuleSupport.hasName(ctx, send.fun(), "helpers") || !isLocal(send.recv(), app)) {
                continue;
            }
            for (Expression helper : send.args()) {
                if (RuleSupport.isConstantLike(helper)) {
                    // The helpers call stays in the method, so the module is copied.
                    result.add(Nodes.send1(helper.loc(), Nodes.self(helper.loc()), ctx.name("include"),
                        DeepCopier.copy(helper)));
                }
            }
        }
        if (result.isEmpty()) {
            return List.of();
        }
        result.add(0, mdef);
        return result;
    }

    private static boolean isLocal(Expression recv, UnresolvedIdent app) {
        return recv instanceof UnresolvedIdent
            && ((UnresolvedIdent) recv).kind() == UnresolvedIdent.Kind.LOCAL
            && ((UnresolvedIdent) recv).name().equals(app.name());
    }
}
