package com.rubyast.dsl.rules;

import com.rubyast.ast.Assign;
import com.rubyast.ast.ClassDefKind;
import com.rubyast.ast.Expression;
import com.rubyast.ast.Nodes;
import com.rubyast.ast.Send;
import com.rubyast.ast.UnresolvedConstantLit;
import com.rubyast.core.Loc;
import com.rubyast.core.MutableContext;
import com.rubyast.core.NameRef;
import com.rubyast.dsl.DslErrors;
import com.rubyast.dsl.StatementRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns {@code A = Struct.new(:x, :y)} into
 *
 * <pre>
 * class A &lt; Struct
 *   def x; @x; end
 *   def x=(x); @x = x; end
 *   def y; @y; end
 *   def y=(y); @y = y; end
 *   def initialize(x = nil, y = nil); @x = x; @y = y; end
 * end
 * </pre>
 *
 * Calls with a block are left alone.
 */
public final class Struct implements StatementRule<Assign> {

    @Override
    public List<Expression> replace(MutableContext ctx, Assign asgn, Expression prevStat) {
        if (!(asgn.lhs() instanceof UnresolvedConstantLit) || !(asgn.rhs() instanceof Send)) {
            return List.of();
        }
        Send send = (Send) asgn.rhs();
        if (!RuleSupport.isConstant(ctx, send.recv(), "Struct") || !RuleSupport.hasName(ctx, send.fun(), "new")
            || send.block() != null) {
            return List.of();
        }

        List<NameRef> members = new ArrayList<>();
        for (Expression arg : send.args()) {
            NameRef member = RuleSupport.symbolArg(arg);
            if (member == null) {
                ctx.reportError(arg.loc(), DslErrors.BAD_STRUCT_MEMBER, "Struct member must be a Symbol");
                return List.of();
            }
            if (members.contains(member)) {
                ctx.reportError(arg.loc(), DslErrors.BAD_STRUCT_MEMBER,
                    "Duplicate Struct member `" + RuleSupport.text(ctx, member) + "`");
                return List.of();
            }
            members.add(member);
        }

        Loc loc = asgn.loc();
        List<Expression> body = new ArrayList<>();
        List<Expression> initArgs = new ArrayList<>();
        List<Expression> initStats = new ArrayList<>();
        for (NameRef member : members) {
            String text = RuleSupport.text(ctx, member);
            body.add(RuleSupport.reader(loc, member, RuleSupport.instanceVar(ctx, loc, text)));
            body.add(RuleSupport.writer(ctx, loc, text, text));
            initArgs.add(Nodes.optionalArg(loc, Nodes.localIdent(loc, member), Nodes.nil(loc)));
            initStats.add(Nodes.assign(loc, RuleSupport.instanceVar(ctx, loc, text), Nodes.localIdent(loc, member)));
        }
        Expression initBody;
        if (initStats.isEmpty()) {
            initBody = Nodes.emptyTree();
        } else if (initStats.size() == 1) {
            initBody = initStats.get(0);
        } else {
            initBody = Nodes.insSeq(loc, initStats.subList(0, initStats.size() - 1), initStats.get(initStats.size() - 1));
        }
        body.add(Nodes.method(loc, ctx.name("initialize"), initArgs, initBody, RuleSupport.SYNTHESIZED));

        // The assignment is dropped, so its name moves into the class.
        return List.of(Nodes.classDef(loc, ClassDefKind.CLASS, asgn.lhs(),
            List.of(Nodes.constant(send.recv().loc(), ctx.name("Struct"))), body));
    }
}
