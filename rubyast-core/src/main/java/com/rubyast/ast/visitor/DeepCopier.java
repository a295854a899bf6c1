package com.rubyast.ast.visitor;

import com.rubyast.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Copies a subtree into fresh node instances. Handles and Locs are shared; nodes never are.
 */
public final class DeepCopier implements ExpressionVisitor<Expression, Void> {

    private static final DeepCopier INSTANCE = new DeepCopier();

    private DeepCopier() {
    }

    @SuppressWarnings("unchecked")
    public static <T extends Expression> T copy(T tree) {
        return (T) tree.accept(INSTANCE, null);
    }

    private <T extends Expression> List<T> copyAll(List<T> list) {
        List<T> result = new ArrayList<>(list.size());
        for (T e : list) {
            result.add(copy(e));
        }
        return result;
    }

    @Override
    public Expression visit(ClassDef n, Void arg) {
        return new ClassDef(n.loc(), n.declLoc(), n.symbol(), n.kind(), copy(n.name()),
            copyAll(n.ancestors()), copyAll(n.rhs()));
    }

    @Override
    public Expression visit(MethodDef n, Void arg) {
        return new MethodDef(n.loc(), n.declLoc(), n.symbol(), n.name(), copyAll(n.args()), copy(n.rhs()), n.flags());
    }

    @Override
    public Expression visit(If n, Void arg) {
        return new If(n.loc(), copy(n.cond()), copy(n.thenp()), copy(n.elsep()));
    }

    @Override
    public Expression visit(While n, Void arg) {
        return new While(n.loc(), copy(n.cond()), copy(n.body()));
    }

    @Override
    public Expression visit(Break n, Void arg) {
        return new Break(n.loc(), copy(n.expr()));
    }

    @Override
    public Expression visit(Retry n, Void arg) {
        return new Retry(n.loc());
    }

    @Override
    public Expression visit(Next n, Void arg) {
        return new Next(n.loc(), copy(n.expr()));
    }

    @Override
    public Expression visit(Return n, Void arg) {
        return new Return(n.loc(), copy(n.expr()));
    }

    @Override
    public Expression visit(Yield n, Void arg) {
        return new Yield(n.loc(), copyAll(n.args()));
    }

    @Override
    public Expression visit(RescueCase n, Void arg) {
        return new RescueCase(n.loc(), copyAll(n.exceptions()), copy(n.var()), copy(n.body()));
    }

    @Override
    public Expression visit(Rescue n, Void arg) {
        return new Rescue(n.loc(), copy(n.body()), copyAll(n.rescueCases()), copy(n.elseBranch()), copy(n.ensure()));
    }

    @Override
    public Expression visit(Field n, Void arg) {
        return new Field(n.loc(), n.symbol());
    }

    @Override
    public Expression visit(Local n, Void arg) {
        return new Local(n.loc(), n.localVariable());
    }

    @Override
    public Expression visit(UnresolvedIdent n, Void arg) {
        return new UnresolvedIdent(n.loc(), n.kind(), n.name());
    }

    @Override
    public Expression visit(RestArg n, Void arg) {
        return new RestArg(n.loc(), copy(n.expr()));
    }

    @Override
    public Expression visit(KeywordArg n, Void arg) {
        return new KeywordArg(n.loc(), copy(n.expr()));
    }

    @Override
    public Expression visit(OptionalArg n, Void arg) {
        return new OptionalArg(n.loc(), copy(n.expr()), copy(n.defaultValue()));
    }

    @Override
    public Expression visit(BlockArg n, Void arg) {
        return new BlockArg(n.loc(), copy(n.expr()));
    }

    @Override
    public Expression visit(ShadowArg n, Void arg) {
        return new ShadowArg(n.loc(), copy(n.expr()));
    }

    @Override
    public Expression visit(Assign n, Void arg) {
        return new Assign(n.loc(), copy(n.lhs()), copy(n.rhs()));
    }

    @Override
    public Expression visit(Send n, Void arg) {
        Block block = n.block() == null ? null : copy(n.block());
        return new Send(n.loc(), copy(n.recv()), n.fun(), copyAll(n.args()), block);
    }

    @Override
    public Expression visit(Cast n, Void arg) {
        return new Cast(n.loc(), n.castType(), copy(n.arg()), n.cast());
    }

    @Override
    public Expression visit(Hash n, Void arg) {
        return new Hash(n.loc(), copyAll(n.keys()), copyAll(n.values()));
    }

    @Override
    public Expression visit(Array n, Void arg) {
        return new Array(n.loc(), copyAll(n.elems()));
    }

    @Override
    public Expression visit(Literal n, Void arg) {
        return new Literal(n.loc(), n.value());
    }

    @Override
    public Expression visit(UnresolvedConstantLit n, Void arg) {
        return new UnresolvedConstantLit(n.loc(), copy(n.scope()), n.cnst());
    }

    @Override
    public Expression visit(ConstantLit n, Void arg) {
        UnresolvedConstantLit original = n.original() == null ? null : copy(n.original());
        return new ConstantLit(n.loc(), n.symbol(), original, copy(n.typeAlias()));
    }

    @Override
    public Expression visit(ZSuperArgs n, Void arg) {
        return new ZSuperArgs(n.loc());
    }

    @Override
    public Expression visit(Self n, Void arg) {
        return new Self(n.loc(), n.claz());
    }

    @Override
    public Expression visit(Block n, Void arg) {
        return new Block(n.loc(), copyAll(n.args()), copy(n.body()), n.symbol());
    }

    @Override
    public Expression visit(InsSeq n, Void arg) {
        return new InsSeq(n.loc(), copyAll(n.stats()), copy(n.expr()));
    }

    @Override
    public Expression visit(EmptyTree n, Void arg) {
        return new EmptyTree();
    }
}
