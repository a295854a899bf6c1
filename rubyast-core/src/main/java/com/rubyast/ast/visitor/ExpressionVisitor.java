package com.rubyast.ast.visitor;

import com.rubyast.ast.*;

/**
 * Exhaustive dispatch over the closed set of {@link Expression} variants.
 *
 * <p>There is one overload per variant and no default: a new variant does not compile
 * until every implementation handles it.</p>
 *
 * @param <R> result type
 * @param <A> argument threaded through the visit
 */
public interface ExpressionVisitor<R, A> {

    R visit(ClassDef n, A arg);

    R visit(MethodDef n, A arg);

    R visit(If n, A arg);

    R visit(While n, A arg);

    R visit(Break n, A arg);

    R visit(Retry n, A arg);

    R visit(Next n, A arg);

    R visit(Return n, A arg);

    R visit(Yield n, A arg);

    R visit(RescueCase n, A arg);

    R visit(Rescue n, A arg);

    R visit(Field n, A arg);

    R visit(Local n, A arg);

    R visit(UnresolvedIdent n, A arg);

    R visit(RestArg n, A arg);

    R visit(KeywordArg n, A arg);

    R visit(OptionalArg n, A arg);

    R visit(BlockArg n, A arg);

    R visit(ShadowArg n, A arg);

    R visit(Assign n, A arg);

    R visit(Send n, A arg);

    R visit(Cast n, A arg);

    R visit(Hash n, A arg);

    R visit(Array n, A arg);

    R visit(Literal n, A arg);

    R visit(UnresolvedConstantLit n, A arg);

    R visit(ConstantLit n, A arg);

    R visit(ZSuperArgs n, A arg);

    R visit(Self n, A arg);

    R visit(Block n, A arg);

    R visit(InsSeq n, A arg);

    R visit(EmptyTree n, A arg);
}
