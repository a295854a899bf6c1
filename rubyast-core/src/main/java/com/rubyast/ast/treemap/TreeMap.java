package com.rubyast.ast.treemap;

import com.rubyast.ast.*;
import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.common.Enforce;

import java.util.ArrayList;
import java.util.List;

/**
 * Bottom-up tree rewriting driven by a {@link TreeTransformer}.
 *
 * <p>Children are mapped before their parent's post hook runs. A node whose mapped
 * children are all the same instances as before is passed to its post hook unchanged;
 * otherwise it is rebuilt with its original Loc. {@link ConstantLit#original()} is
 * provenance, not a child, and is never visited.</p>
 */
public final class TreeMap {

    private TreeMap() {
    }

    public static <C> Expression apply(C ctx, TreeTransformer<C> func, Expression tree) {
        Enforce.notNull(tree, "tree");
        return tree.accept(new Mapper<>(ctx, func), null);
    }

    private static final class Mapper<C> implements ExpressionVisitor<Expression, Void> {
        private final C ctx;
        private final TreeTransformer<C> func;

        Mapper(C ctx, TreeTransformer<C> func) {
            this.ctx = ctx;
            this.func = func;
        }

        private Expression map(Expression e) {
            return e.accept(this, null);
        }

        private <T extends Expression> T map(Expression e, Class<T> slot, String where) {
            Expression result = map(e);
            Enforce.check(slot.isInstance(result), "slot.isInstance(result)",
                where, " was rewritten to a ", result.type(), ", expected ", slot.getSimpleName());
            return slot.cast(result);
        }

        /**
         * Returns {@code list} itself when no element changed.
         */
        private <T extends Expression> List<T> mapList(List<T> list, Class<T> slot, String where) {
            List<T> result = null;
            for (int i = 0; i < list.size(); i++) {
                T before = list.get(i);
                T after = map(before, slot, where);
                if (after != before && result == null) {
                    result = new ArrayList<>(list.subList(0, i));
                }
                if (result != null) {
                    result.add(after);
                }
            }
            return result == null ? list : result;
        }

        private static Expression post(Expression result, Expression original) {
            Enforce.check(result != null, "result != null",
                "postTransform", original.type(), " returned null; use EmptyTree instead");
            return result;
        }

        private static <T extends Expression> T pre(T result, Expression original) {
            Enforce.check(result != null, "result != null", "preTransform", original.type(), " returned null");
            return result;
        }

        @Override
        public Expression visit(ClassDef original, Void arg) {
            ClassDef n = pre(func.preTransformClassDef(ctx, original), original);
            Expression name = map(n.name());
            List<Expression> ancestors = mapList(n.ancestors(), Expression.class, "ClassDef.ancestors");
            List<Expression> rhs = mapList(n.rhs(), Expression.class, "ClassDef.rhs");
            if (name != n.name() || ancestors != n.ancestors() || rhs != n.rhs()) {
                n = new ClassDef(n.loc(), n.declLoc(), n.symbol(), n.kind(), name, ancestors, rhs);
            }
            return post(func.postTransformClassDef(ctx, n), n);
        }

        @Override
        public Expression visit(MethodDef original, Void arg) {
            MethodDef n = pre(func.preTransformMethodDef(ctx, original), original);
            List<Expression> args = mapList(n.args(), Expression.class, "MethodDef.args");
            Expression rhs = map(n.rhs());
            if (args != n.args() || rhs != n.rhs()) {
                n = new MethodDef(n.loc(), n.declLoc(), n.symbol(), n.name(), args, rhs, n.flags());
            }
            return post(func.postTransformMethodDef(ctx, n), n);
        }

        @Override
        public Expression visit(If n, Void arg) {
            Expression cond = map(n.cond());
            Expression thenp = map(n.thenp());
            Expression elsep = map(n.elsep());
            if (cond != n.cond() || thenp != n.thenp() || elsep != n.elsep()) {
                n = new If(n.loc(), cond, thenp, elsep);
            }
            return post(func.postTransformIf(ctx, n), n);
        }

        @Override
        public Expression visit(While n, Void arg) {
            Expression cond = map(n.cond());
            Expression body = map(n.body());
            if (cond != n.cond() || body != n.body()) {
                n = new While(n.loc(), cond, body);
            }
            return post(func.postTransformWhile(ctx, n), n);
        }

        @Override
        public Expression visit(Break n, Void arg) {
            Expression expr = map(n.expr());
            if (expr != n.expr()) {
                n = new Break(n.loc(), expr);
            }
            return post(func.postTransformBreak(ctx, n), n);
        }

        @Override
        public Expression visit(Retry n, Void arg) {
            return post(func.postTransformRetry(ctx, n), n);
        }

        @Override
        public Expression visit(Next n, Void arg) {
            Expression expr = map(n.expr());
            if (expr != n.expr()) {
                n = new Next(n.loc(), expr);
            }
            return post(func.postTransformNext(ctx, n), n);
        }

        @Override
        public Expression visit(Return n, Void arg) {
            Expression expr = map(n.expr());
            if (expr != n.expr()) {
                n = new Return(n.loc(), expr);
            }
            return post(func.postTransformReturn(ctx, n), n);
        }

        @Override
        public Expression visit(Yield n, Void arg) {
            List<Expression> args = mapList(n.args(), Expression.class, "Yield.args");
            if (args != n.args()) {
                n = new Yield(n.loc(), args);
            }
            return post(func.postTransformYield(ctx, n), n);
        }

        @Override
        public Expression visit(RescueCase n, Void arg) {
            List<Expression> exceptions = mapList(n.exceptions(), Expression.class, "RescueCase.exceptions");
            Expression var = map(n.var());
            Expression body = map(n.body());
            if (exceptions != n.exceptions() || var != n.var() || body != n.body()) {
                n = new RescueCase(n.loc(), exceptions, var, body);
            }
            return post(func.postTransformRescueCase(ctx, n), n);
        }

        @Override
        public Expression visit(Rescue n, Void arg) {
            Expression body = map(n.body());
            List<RescueCase> rescueCases = mapList(n.rescueCases(), RescueCase.class, "Rescue.rescueCases");
            Expression elseBranch = map(n.elseBranch());
            Expression ensure = map(n.ensure());
            if (body != n.body() || rescueCases != n.rescueCases() || elseBranch != n.elseBranch()
                || ensure != n.ensure()) {
                n = new Rescue(n.loc(), body, rescueCases, elseBranch, ensure);
            }
            return post(func.postTransformRescue(ctx, n), n);
        }

        @Override
        public Expression visit(Field n, Void arg) {
            return post(func.postTransformField(ctx, n), n);
        }

        @Override
        public Expression visit(Local n, Void arg) {
            return post(func.postTransformLocal(ctx, n), n);
        }

        @Override
        public Expression visit(UnresolvedIdent n, Void arg) {
            return post(func.postTransformUnresolvedIdent(ctx, n), n);
        }

        @Override
        public Expression visit(RestArg n, Void arg) {
            Reference expr = map(n.expr(), Reference.class, "RestArg.expr");
            if (expr != n.expr()) {
                n = new RestArg(n.loc(), expr);
            }
            return post(func.postTransformRestArg(ctx, n), n);
        }

        @Override
        public Expression visit(KeywordArg n, Void arg) {
            Reference expr = map(n.expr(), Reference.class, "KeywordArg.expr");
            if (expr != n.expr()) {
                n = new KeywordArg(n.loc(), expr);
            }
            return post(func.postTransformKeywordArg(ctx, n), n);
        }

        @Override
        public Expression visit(OptionalArg n, Void arg) {
            Reference expr = map(n.expr(), Reference.class, "OptionalArg.expr");
            Expression defaultValue = map(n.defaultValue());
            if (expr != n.expr() || defaultValue != n.defaultValue()) {
                n = new OptionalArg(n.loc(), expr, defaultValue);
            }
            return post(func.postTransformOptionalArg(ctx, n), n);
        }

        @Override
        public Expression visit(BlockArg n, Void arg) {
            Reference expr = map(n.expr(), Reference.class, "BlockArg.expr");
            if (expr != n.expr()) {
                n = new BlockArg(n.loc(), expr);
            }
            return post(func.postTransformBlockArg(ctx, n), n);
        }

        @Override
        public Expression visit(ShadowArg n, Void arg) {
            Reference expr = map(n.expr(), Reference.class, "ShadowArg.expr");
            if (expr != n.expr()) {
                n = new ShadowArg(n.loc(), expr);
            }
            return post(func.postTransformShadowArg(ctx, n), n);
        }

        @Override
        public Expression visit(Assign n, Void arg) {
            Expression lhs = map(n.lhs());
            Expression rhs = map(n.rhs());
            if (lhs != n.lhs() || rhs != n.rhs()) {
                n = new Assign(n.loc(), lhs, rhs);
            }
            return post(func.postTransformAssign(ctx, n), n);
        }

        @Override
        public Expression visit(Send n, Void arg) {
            Expression recv = map(n.recv());
            List<Expression> args = mapList(n.args(), Expression.class, "Send.args");
            Block block = n.block() == null ? null : map(n.block(), Block.class, "Send.block");
            if (recv != n.recv() || args != n.args() || block != n.block()) {
                n = new Send(n.loc(), recv, n.fun(), args, block);
            }
            return post(func.postTransformSend(ctx, n), n);
        }

        @Override
        public Expression visit(Cast n, Void arg) {
            Expression expr = map(n.arg());
            if (expr != n.arg()) {
                n = new Cast(n.loc(), n.castType(), expr, n.cast());
            }
            return post(func.postTransformCast(ctx, n), n);
        }

        @Override
        public Expression visit(Hash n, Void arg) {
            List<Expression> keys = mapList(n.keys(), Expression.class, "Hash.keys");
            List<Expression> values = mapList(n.values(), Expression.class, "Hash.values");
            if (keys != n.keys() || values != n.values()) {
                n = new Hash(n.loc(), keys, values);
            }
            return post(func.postTransformHash(ctx, n), n);
        }

        @Override
        public Expression visit(Array n, Void arg) {
            List<Expression> elems = mapList(n.elems(), Expression.class, "Array.elems");
            if (elems != n.elems()) {
                n = new Array(n.loc(), elems);
            }
            return post(func.postTransformArray(ctx, n), n);
        }

        @Override
        public Expression visit(Literal n, Void arg) {
            return post(func.postTransformLiteral(ctx, n), n);
        }

        @Override
        public Expression visit(UnresolvedConstantLit n, Void arg) {
            Expression scope = map(n.scope());
            if (scope != n.scope()) {
                n = new UnresolvedConstantLit(n.loc(), scope, n.cnst());
            }
            return post(func.postTransformUnresolvedConstantLit(ctx, n), n);
        }

        @Override
        public Expression visit(ConstantLit n, Void arg) {
            Expression typeAlias = map(n.typeAlias());
            if (typeAlias != n.typeAlias()) {
                n = new ConstantLit(n.loc(), n.symbol(), n.original(), typeAlias);
            }
            return post(func.postTransformConstantLit(ctx, n), n);
        }

        @Override
        public Expression visit(ZSuperArgs n, Void arg) {
            return post(func.postTransformZSuperArgs(ctx, n), n);
        }

        @Override
        public Expression visit(Self n, Void arg) {
            return post(func.postTransformSelf(ctx, n), n);
        }

        @Override
        public Expression visit(Block original, Void arg) {
            Block n = pre(func.preTransformBlock(ctx, original), original);
            List<Expression> args = mapList(n.args(), Expression.class, "Block.args");
            Expression body = map(n.body());
            if (args != n.args() || body != n.body()) {
                n = new Block(n.loc(), args, body, n.symbol());
            }
            return post(func.postTransformBlock(ctx, n), n);
        }

        @Override
        public Expression visit(InsSeq n, Void arg) {
            List<Expression> stats = mapList(n.stats(), Expression.class, "InsSeq.stats");
            Expression expr = map(n.expr());
            if (stats != n.stats() || expr != n.expr()) {
                n = new InsSeq(n.loc(), stats, expr);
            }
            return post(func.postTransformInsSeq(ctx, n), n);
        }

        @Override
        public Expression visit(EmptyTree n, Void arg) {
            return post(func.postTransformEmptyTree(ctx, n), n);
        }
    }
}
