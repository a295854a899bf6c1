package com.rubyast.ast.visitor;

import com.rubyast.ast.*;

/**
 * Visitor for code that only cares about some variants. Every variant routes to
 * {@link #defaultAction(Expression, Object)}, which each subclass must supply.
 */
public abstract class ExpressionVisitorWithDefaults<R, A> implements ExpressionVisitor<R, A> {

    /**
     * Handles every variant the subclass does not override.
     */
    public abstract R defaultAction(Expression n, A arg);

    @Override
    public R visit(ClassDef n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(MethodDef n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(If n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(While n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Break n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Retry n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Next n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Return n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Yield n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(RescueCase n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Rescue n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Field n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Local n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(UnresolvedIdent n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(RestArg n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(KeywordArg n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(OptionalArg n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BlockArg n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ShadowArg n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Assign n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Send n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Cast n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Hash n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Array n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Literal n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(UnresolvedConstantLit n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ConstantLit n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ZSuperArgs n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Self n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Block n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(InsSeq n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(EmptyTree n, A arg) {
        return defaultAction(n, arg);
    }
}
