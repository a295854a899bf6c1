package com.rubyast.ast;

import com.rubyast.core.Loc;
import com.rubyast.core.NameRef;

import java.util.List;

/**
 * Shorthand constructors for the nodes rewrite rules synthesize.
 */
public final class Nodes {

    private Nodes() {
        // Utility class
    }

    public static EmptyTree emptyTree() {
        return new EmptyTree();
    }

    public static Self self(Loc loc) {
        return new Self(loc, null);
    }

    public static Send send(Loc loc, Expression recv, NameRef fun, List<Expression> args) {
        return new Send(loc, recv, fun, args);
    }

    public static Send send(Loc loc, Expression recv, NameRef fun, List<Expression> args, Block block) {
        return new Send(loc, recv, fun, args, block);
    }

    public static Send send0(Loc loc, Expression recv, NameRef fun) {
        return new Send(loc, recv, fun, List.of());
    }

    public static Send send1(Loc loc, Expression recv, NameRef fun, Expression arg0) {
        return new Send(loc, recv, fun, List.of(arg0));
    }

    public static Send send2(Loc loc, Expression recv, NameRef fun, Expression arg0, Expression arg1) {
        return new Send(loc, recv, fun, List.of(arg0, arg1));
    }

    /**
     * {@code scope::name}, unresolved.
     */
    public static UnresolvedConstantLit constant(Loc loc, Expression scope, NameRef name) {
        return new UnresolvedConstantLit(loc, scope, name);
    }

    /**
     * A constant looked up lexically, e.g. {@code T} or {@code Struct}.
     */
    public static UnresolvedConstantLit constant(Loc loc, NameRef name) {
        return new UnresolvedConstantLit(loc, emptyTree(), name);
    }

    public static UnresolvedIdent instanceIdent(Loc loc, NameRef name) {
        return new UnresolvedIdent(loc, UnresolvedIdent.Kind.INSTANCE, name);
    }

    public static UnresolvedIdent localIdent(Loc loc, NameRef name) {
        return new UnresolvedIdent(loc, UnresolvedIdent.Kind.LOCAL, name);
    }

    public static OptionalArg optionalArg(Loc loc, Reference expr, Expression defaultValue) {
        return new OptionalArg(loc, expr, defaultValue);
    }

    public static Literal symbol(Loc loc, NameRef name) {
        return new Literal(loc, new LiteralValue.SymbolValue(name));
    }

    public static Literal string(Loc loc, NameRef value) {
        return new Literal(loc, new LiteralValue.StringValue(value));
    }

    public static Literal integer(Loc loc, long value) {
        return new Literal(loc, new LiteralValue.IntegerValue(value));
    }

    public static Literal nil(Loc loc) {
        return new Literal(loc, new LiteralValue.NilValue());
    }

    public static Literal trueLit(Loc loc) {
        return new Literal(loc, new LiteralValue.TrueValue());
    }

    public static Literal falseLit(Loc loc) {
        return new Literal(loc, new LiteralValue.FalseValue());
    }

    public static Assign assign(Loc loc, Expression lhs, Expression rhs) {
        return new Assign(loc, lhs, rhs);
    }

    public static InsSeq insSeq(Loc loc, List<Expression> stats, Expression expr) {
        return new InsSeq(loc, stats, expr);
    }

    public static MethodDef method(Loc loc, NameRef name, List<Expression> args, Expression rhs, int flags) {
        return new MethodDef(loc, name, args, rhs, flags);
    }

    public static MethodDef method0(Loc loc, NameRef name, Expression rhs, int flags) {
        return new MethodDef(loc, name, List.of(), rhs, flags);
    }

    public static MethodDef method1(Loc loc, NameRef name, Reference arg0, Expression rhs, int flags) {
        return new MethodDef(loc, name, List.of(arg0), rhs, flags);
    }

    public static ClassDef classDef(Loc loc, ClassDefKind kind, Expression name, List<Expression> ancestors,
                                    List<Expression> rhs) {
        return new ClassDef(loc, loc, null, kind, name, ancestors, rhs);
    }
}
