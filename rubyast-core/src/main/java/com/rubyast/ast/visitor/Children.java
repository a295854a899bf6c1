package com.rubyast.ast.visitor;

import com.rubyast.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the direct children of a node in field order. An absent {@link Send#block()} is
 * skipped, and so is {@link ConstantLit#original()}, which is provenance rather than a child.
 */
public final class Children implements ExpressionVisitor<List<Expression>, Void> {

    private static final Children INSTANCE = new Children();

    private Children() {
    }

    public static List<Expression> of(Expression node) {
        return node.accept(INSTANCE, null);
    }

    private static List<Expression> concat(List<? extends Expression> first, Expression... rest) {
        List<Expression> result = new ArrayList<>(first.size() + rest.length);
        result.addAll(first);
        result.addAll(List.of(rest));
        return result;
    }

    @Override
    public List<Expression> visit(ClassDef n, Void arg) {
        List<Expression> result = new ArrayList<>();
        result.add(n.name());
        result.addAll(n.ancestors());
        result.addAll(n.rhs());
        return result;
    }

    @Override
    public List<Expression> visit(MethodDef n, Void arg) {
        return concat(n.args(), n.rhs());
    }

    @Override
    public List<Expression> visit(If n, Void arg) {
        return List.of(n.cond(), n.thenp(), n.elsep());
    }

    @Override
    public List<Expression> visit(While n, Void arg) {
        return List.of(n.cond(), n.body());
    }

    @Override
    public List<Expression> visit(Break n, Void arg) {
        return List.of(n.expr());
    }

    @Override
    public List<Expression> visit(Retry n, Void arg) {
        return List.of();
    }

    @Override
    public List<Expression> visit(Next n, Void arg) {
        return List.of(n.expr());
    }

    @Override
    public List<Expression> visit(Return n, Void arg) {
        return List.of(n.expr());
    }

    @Override
    public List<Expression> visit(Yield n, Void arg) {
        return List.copyOf(n.args());
    }

    @Override
    public List<Expression> visit(RescueCase n, Void arg) {
        return concat(n.exceptions(), n.var(), n.body());
    }

    @Override
    public List<Expression> visit(Rescue n, Void arg) {
        List<Expression> result = new ArrayList<>();
        result.add(n.body());
        result.addAll(n.rescueCases());
        result.add(n.elseBranch());
        result.add(n.ensure());
        return result;
    }

    @Override
    public List<Expression> visit(Field n, Void arg) {
        return List.of();
    }

    @Override
    public List<Expression> visit(Local n, Void arg) {
        return List.of();
    }

    @Override
    public List<Expression> visit(UnresolvedIdent n, Void arg) {
        return List.of();
    }

    @Override
    public List<Expression> visit(RestArg n, Void arg) {
        return List.of(n.expr());
    }

    @Override
    public List<Expression> visit(KeywordArg n, Void arg) {
        return List.of(n.expr());
    }

    @Override
    public List<Expression> visit(OptionalArg n, Void arg) {
        return List.of(n.expr(), n.defaultValue());
    }

    @Override
    public List<Expression> visit(BlockArg n, Void arg) {
        return List.of(n.expr());
    }

    @Override
    public List<Expression> visit(ShadowArg n, Void arg) {
        return List.of(n.expr());
    }

    @Override
    public List<Expression> visit(Assign n, Void arg) {
        return List.of(n.lhs(), n.rhs());
    }

    @Override
    public List<Expression> visit(Send n, Void arg) {
        List<Expression> result = new ArrayList<>();
        result.add(n.recv());
        result.addAll(n.args());
        if (n.block() != null) {
            result.add(n.block());
        }
        return result;
    }

    @Override
    public List<Expression> visit(Cast n, Void arg) {
        return List.of(n.arg());
    }

    @Override
    public List<Expression> visit(Hash n, Void arg) {
        List<Expression> result = new ArrayList<>();
        for (int i = 0; i < n.keys().size(); i++) {
            result.add(n.keys().get(i));
            result.add(n.values().get(i));
        }
        return result;
    }

    @Override
    public List<Expression> visit(Array n, Void arg) {
        return List.copyOf(n.elems());
    }

    @Override
    public List<Expression> visit(Literal n, Void arg) {
        return List.of();
    }

    @Override
    public List<Expression> visit(UnresolvedConstantLit n, Void arg) {
        return List.of(n.scope());
    }

    @Override
    public List<Expression> visit(ConstantLit n, Void arg) {
        return List.of(n.typeAlias());
    }

    @Override
    public List<Expression> visit(ZSuperArgs n, Void arg) {
        return List.of();
    }

    @Override
    public List<Expression> visit(Self n, Void arg) {
        return List.of();
    }

    @Override
    public List<Expression> visit(Block n, Void arg) {
        return concat(n.args(), n.body());
    }

    @Override
    public List<Expression> visit(InsSeq n, Void arg) {
        return concat(n.stats(), n.expr());
    }

    @Override
    public List<Expression> visit(EmptyTree n, Void arg) {
        return List.of();
    }
}
