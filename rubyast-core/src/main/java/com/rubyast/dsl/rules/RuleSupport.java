package com.rubyast.dsl.rules;

import com.rubyast.ast.ConstantLit;
import com.rubyast.ast.EmptyTree;
import com.rubyast.ast.Expression;
import com.rubyast.ast.Literal;
import com.rubyast.ast.LiteralValue;
import com.rubyast.ast.MethodDef;
import com.rubyast.ast.Nodes;
import com.rubyast.ast.Self;
import com.rubyast.ast.Send;
import com.rubyast.ast.UnresolvedConstantLit;
import com.rubyast.ast.UnresolvedIdent;
import com.rubyast.core.Loc;
import com.rubyast.core.MutableContext;
import com.rubyast.core.NameRef;

/**
 * Matching helpers shared by the rules in this package.
 */
final class RuleSupport {

    static final int SYNTHESIZED = MethodDef.DSL_SYNTHESIZED;
    static final int SELF_SYNTHESIZED = MethodDef.SELF_METHOD | MethodDef.DSL_SYNTHESIZED;

    private RuleSupport() {
    }

    static boolean hasName(MutableContext ctx, NameRef name, String text) {
        return name.exists() && ctx.state().nameText(name).equals(text);
    }

    static String text(MutableContext ctx, NameRef name) {
        return ctx.state().nameText(name);
    }

    /**
     * A call with an implicit receiver, e.g. {@code prop :foo}.
     */
    static boolean isSelfCall(MutableContext ctx, Send send, String fun) {
        return send.recv() instanceof Self && hasName(ctx, send.fun(), fun);
    }

    /**
     * Returns the name of a {@code :symbol} literal, or null for anything else.
     */
    static NameRef symbolArg(Expression arg) {
        if (arg instanceof Literal && ((Literal) arg).value() instanceof LiteralValue.SymbolValue) {
            return ((LiteralValue.SymbolValue) ((Literal) arg).value()).value();
        }
        return null;
    }

    /**
     * Returns the name carried by a {@code :symbol} or {@code "string"} literal, or null.
     */
    static NameRef symbolOrStringArg(Expression arg) {
        NameRef name = symbolArg(arg);
        if (name != null) {
            return name;
        }
        if (arg instanceof Literal && ((Literal) arg).value() instanceof LiteralValue.StringValue) {
            return ((LiteralValue.StringValue) ((Literal) arg).value()).value();
        }
        return null;
    }

    /**
     * Whether {@code expr} names the constant {@code path}, e.g. {@code "Opus", "Command"}.
     * Unresolved constants are matched by their scope chain, resolved ones by the
     * symbol's full name.
     */
    static boolean isConstant(MutableContext ctx, Expression expr, String... path) {
        if (expr instanceof ConstantLit) {
            ConstantLit constant = (ConstantLit) expr;
            if (ctx.state().symbolExists(constant.symbol())) {
                return ctx.state().symbolFullName(constant.symbol()).equals(String.join("::", path));
            }
            return constant.original() != null && isConstant(ctx, constant.original(), path);
        }
        Expression current = expr;
        for (int i = path.length - 1; i >= 0; i--) {
            if (!(current instanceof UnresolvedConstantLit)) {
                return false;
            }
            UnresolvedConstantLit lit = (UnresolvedConstantLit) current;
            if (!hasName(ctx, lit.cnst(), path[i])) {
                return false;
            }
            current = lit.scope();
        }
        return current instanceof EmptyTree;
    }

    static boolean isConstantLike(Expression expr) {
        return expr instanceof UnresolvedConstantLit || expr instanceof ConstantLit;
    }

    static UnresolvedIdent instanceVar(MutableContext ctx, Loc loc, String name) {
        return Nodes.instanceIdent(loc, ctx.name("@" + name));
    }

    /**
     * {@code def name; body; end}
     */
    static MethodDef reader(Loc loc, NameRef name, Expression body) {
        return Nodes.method0(loc, name, body, SYNTHESIZED);
    }

    /**
     * {@code def name=(name); @ivar = name; end}
     */
    static MethodDef writer(MutableContext ctx, Loc loc, String name, String ivar) {
        NameRef argName = ctx.name(name);
        Expression body = Nodes.assign(loc, instanceVar(ctx, loc, ivar), Nodes.localIdent(loc, argName));
        return Nodes.method1(loc, ctx.name(name + "="), Nodes.localIdent(loc, argName), body, SYNTHESIZED);
    }

    /**
     * {@code T.let(value, type)}
     */
    static Send tLet(MutableContext ctx, Loc loc, Expression value, Expression type) {
        return Nodes.send2(loc, Nodes.constant(loc, ctx.name("T")), ctx.name("let"), value, type);
    }
}
