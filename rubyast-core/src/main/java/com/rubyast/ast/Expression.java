package com.rubyast.ast;

import com.rubyast.ast.visitor.ExpressionVisitor;
import com.rubyast.ast.visitor.RawPrinter;
import com.rubyast.ast.visitor.SourcePrinter;
import com.rubyast.core.GlobalState;
import com.rubyast.core.Loc;

/**
 * Base interface for every tree node.
 *
 * <p>The set of variants is closed. Code that must handle every variant implements
 * {@link ExpressionVisitor}; adding a variant is then a compile error at each such site
 * until it is handled.</p>
 *
 * <p>Nodes are immutable. A parent exclusively owns its children: a node instance
 * appears at most once in a tree ({@link EmptyTree} excepted), and rewrites replace
 * whole subtrees instead of mutating them.</p>
 */
public sealed interface Expression permits
    Declaration,
    Reference,
    If,
    While,
    Break,
    Retry,
    Next,
    Return,
    Yield,
    RescueCase,
    Rescue,
    Assign,
    Send,
    Cast,
    Hash,
    Array,
    Literal,
    UnresolvedConstantLit,
    ConstantLit,
    ZSuperArgs,
    Self,
    Block,
    InsSeq,
    EmptyTree {

    /**
     * Stable tag of the variant, equal to its simple class name.
     */
    String type();

    Loc loc();

    <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg);

    /**
     * Ruby-like rendering for humans.
     */
    default String toString(GlobalState gs) {
        return SourcePrinter.print(gs, this);
    }

    /**
     * Structural field-by-field dump, used for snapshot tests.
     */
    default String showRaw(GlobalState gs) {
        return RawPrinter.print(gs, this);
    }
}
