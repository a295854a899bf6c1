package com.rubyast.dsl.rules;

import com.rubyast.ast.ClassDef;
import com.rubyast.ast.Expression;
import com.rubyast.ast.MethodDef;
import com.rubyast.ast.Nodes;
import com.rubyast.ast.visitor.DeepCopier;
import com.rubyast.core.MutableContext;
import com.rubyast.dsl.ClassDefRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Subclasses of {@code Opus::Command} are invoked as {@code MyCommand.call(...)} but
 * define an instance method {@code call}. This adds the matching singleton
 * {@code self.call} right after it, with the same parameters.
 */
public final class Command implements ClassDefRule {

    @Override
    public ClassDef patch(MutableContext ctx, ClassDef classDef) {
        boolean isCommand = false;
        for (Expression ancestor : classDef.ancestors()) {
            if (RuleSupport.isConstant(ctx, ancestor, "Opus", "Command")) {
                isCommand = true;
                break;
            }
        }
        if (!isCommand) {
            return classDef;
        }

        int callIndex = -1;
        for (int i = 0; i < classDef.rhs().size(); i++) {
            Expression stat = classDef.rhs().get(i);
            if (!(stat instanceof MethodDef) || !RuleSupport.hasName(ctx, ((MethodDef) stat).name(), "call")) {
                continue;
            }
            if (((MethodDef) stat).isSelf()) {
                // Already has a singleton call.
                return classDef;
            }
            if (callIndex < 0) {
                callIndex = i;
            }
        }
        if (callIndex < 0) {
            return classDef;
        }

        MethodDef call = (MethodDef) classDef.rhs().get(callIndex);
        List<Expression> args = new ArrayList<>();
        for (Expression arg : call.args()) {
            args.add(DeepCopier.copy(arg));
        }
        MethodDef selfCall = Nodes.method(call.loc(), call.name(), args, Nodes.emptyTree(),
            RuleSupport.SELF_SYNTHESIZED);

        List<Expression> rhs = new ArrayList<>(classDef.rhs());
        rhs.add(callIndex + 1, selfCall);
        return classDef.withRhs(rhs);
    }
}
