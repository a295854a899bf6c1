package com.rubyast.ast.treemap;

import com.rubyast.ast.*;

/**
 * Hooks called by {@link TreeMap}. Every hook defaults to the identity.
 *
 * <p>{@code preTransform*} hooks see a node before its children are mapped and must
 * return a node of the same variant. {@code postTransform*} hooks see the node after
 * its children were mapped and may return any replacement. No hook may return null;
 * return an {@link EmptyTree} to drop an expression.</p>
 *
 * @param <C> the context threaded through the walk
 */
public interface TreeTransformer<C> {

    default ClassDef preTransformClassDef(C ctx, ClassDef original) {
        return original;
    }

    default MethodDef preTransformMethodDef(C ctx, MethodDef original) {
        return original;
    }

    default Block preTransformBlock(C ctx, Block original) {
        return original;
    }

    default Expression postTransformClassDef(C ctx, ClassDef original) {
        return original;
    }

    default Expression postTransformMethodDef(C ctx, MethodDef original) {
        return original;
    }

    default Expression postTransformIf(C ctx, If original) {
        return original;
    }

    default Expression postTransformWhile(C ctx, While original) {
        return original;
    }

    default Expression postTransformBreak(C ctx, Break original) {
        return original;
    }

    default Expression postTransformRetry(C ctx, Retry original) {
        return original;
    }

    default Expression postTransformNext(C ctx, Next original) {
        return original;
    }

    default Expression postTransformReturn(C ctx, Return original) {
        return original;
    }

    default Expression postTransformYield(C ctx, Yield original) {
        return original;
    }

    default Expression postTransformRescueCase(C ctx, RescueCase original) {
        return original;
    }

    default Expression postTransformRescue(C ctx, Rescue original) {
        return original;
    }

    default Expression postTransformField(C ctx, Field original) {
        return original;
    }

    default Expression postTransformLocal(C ctx, Local original) {
        return original;
    }

    default Expression postTransformUnresolvedIdent(C ctx, UnresolvedIdent original) {
        return original;
    }

    default Expression postTransformRestArg(C ctx, RestArg original) {
        return original;
    }

    default Expression postTransformKeywordArg(C ctx, KeywordArg original) {
        return original;
    }

    default Expression postTransformOptionalArg(C ctx, OptionalArg original) {
        return original;
    }

    default Expression postTransformBlockArg(C ctx, BlockArg original) {
        return original;
    }

    default Expression postTransformShadowArg(C ctx, ShadowArg original) {
        return original;
    }

    default Expression postTransformAssign(C ctx, Assign original) {
        return original;
    }

    default Expression postTransformSend(C ctx, Send original) {
        return original;
    }

    default Expression postTransformCast(C ctx, Cast original) {
        return original;
    }

    default Expression postTransformHash(C ctx, Hash original) {
        return original;
    }

    default Expression postTransformArray(C ctx, Array original) {
        return original;
    }

    default Expression postTransformLiteral(C ctx, Literal original) {
        return original;
    }

    default Expression postTransformUnresolvedConstantLit(C ctx, UnresolvedConstantLit original) {
        return original;
    }

    default Expression postTransformConstantLit(C ctx, ConstantLit original) {
        return original;
    }

    default Expression postTransformZSuperArgs(C ctx, ZSuperArgs original) {
        return original;
    }

    default Expression postTransformSelf(C ctx, Self original) {
        return original;
    }

    default Expression postTransformBlock(C ctx, Block original) {
        return original;
    }

    default Expression postTransformInsSeq(C ctx, InsSeq original) {
        return original;
    }

    default Expression postTransformEmptyTree(C ctx, EmptyTree original) {
        return original;
    }
}
