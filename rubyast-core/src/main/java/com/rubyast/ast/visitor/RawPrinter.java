package com.rubyast.ast.visitor;

import com.rubyast.ast.*;
import com.rubyast.core.GlobalState;

import java.util.List;

import static com.rubyast.ast.visitor.SourcePrinter.printTabs;

/**
 * Structural dump of a tree: one {@code Name{ field = value }} block per node, nested
 * by indentation. Snapshot tests compare against this format, so keep it stable.
 */
public final class RawPrinter implements ExpressionVisitor<String, Integer> {

    private final GlobalState gs;

    private RawPrinter(GlobalState gs) {
        this.gs = gs;
    }

    public static String print(GlobalState gs, Expression tree) {
        return tree.accept(new RawPrinter(gs), 0);
    }

    private String raw(Expression e, int tabs) {
        return e.accept(this, tabs);
    }

    private void field(StringBuilder buf, int tabs, String name, String value) {
        printTabs(buf, tabs + 1);
        buf.append(name).append(" = ").append(value).append('\n');
    }

    // name = [
    //   elem
    // ]
    private void list(StringBuilder buf, int tabs, String name, List<? extends Expression> elems) {
        printTabs(buf, tabs + 1);
        buf.append(name).append(" = [\n");
        for (Expression e : elems) {
            printTabs(buf, tabs + 2);
            buf.append(raw(e, tabs + 2)).append('\n');
        }
        printTabs(buf, tabs + 1);
        buf.append("]\n");
    }

    // name = [a, b]
    private void inlineList(StringBuilder buf, int tabs, String name, List<? extends Expression> elems) {
        printTabs(buf, tabs + 1);
        buf.append(name).append(" = [");
        boolean first = true;
        for (Expression e : elems) {
            if (!first) {
                buf.append(", ");
            }
            first = false;
            buf.append(raw(e, tabs + 2));
        }
        buf.append("]\n");
    }

    private StringBuilder open(Expression n) {
        return new StringBuilder(n.type()).append("{\n");
    }

    private String close(StringBuilder buf, int tabs) {
        printTabs(buf, tabs);
        buf.append('}');
        return buf.toString();
    }

    private String oneLine(Expression n, String field, String value) {
        return n.type() + "{ " + field + " = " + value + " }";
    }

    @Override
    public String visit(ClassDef n, Integer tabs) {
        StringBuilder buf = open(n);
        field(buf, tabs, "kind", n.kind() == ClassDefKind.MODULE ? "module" : "class");
        field(buf, tabs, "name", raw(n.name(), tabs + 1) + "<" + n.symbol().showName(gs) + ">");
        inlineList(buf, tabs, "ancestors", n.ancestors());
        printTabs(buf, tabs + 1);
        buf.append("rhs = [\n");
        for (int i = 0; i < n.rhs().size(); i++) {
            printTabs(buf, tabs + 2);
            buf.append(raw(n.rhs().get(i), tabs + 2)).append('\n');
            if (i != n.rhs().size() - 1) {
                buf.append('\n');
            }
        }
        printTabs(buf, tabs + 1);
        buf.append("]\n");
        return close(buf, tabs);
    }

    @Override
    public String visit(MethodDef n, Integer tabs) {
        StringBuilder buf = open(n);
        StringBuilder flags = new StringBuilder();
        if (n.isSelf()) {
            flags.append(" self");
        }
        if (n.isDSLSynthesized()) {
            flags.append(" dsl");
        }
        if (n.flags() == 0) {
            flags.append(" 0");
        }
        printTabs(buf, tabs + 1);
        buf.append("flags =").append(flags).append('\n');
        field(buf, tabs, "name", n.name().show(gs) + "<" + n.symbol().showName(gs) + ">");
        inlineList(buf, tabs, "args", n.args());
        field(buf, tabs, "rhs", raw(n.rhs(), tabs + 1));
        return close(buf, tabs);
    }

    @Override
    public String visit(If n, Integer tabs) {
        StringBuilder buf = open(n);
        field(buf, tabs, "cond", raw(n.cond(), tabs + 1));
        field(buf, tabs, "thenp", raw(n.thenp(), tabs + 1));
        field(buf, tabs, "elsep", raw(n.elsep(), tabs + 1));
        return close(buf, tabs);
    }

    @Override
    public String visit(While n, Integer tabs) {
        StringBuilder buf = open(n);
        field(buf, tabs, "cond", raw(n.cond(), tabs + 1));
        field(buf, tabs, "body", raw(n.body(), tabs + 1));
        return close(buf, tabs);
    }

    @Override
    public String visit(Break n, Integer tabs) {
        return oneLine(n, "expr", raw(n.expr(), tabs + 1));
    }

    @Override
    public String visit(Retry n, Integer tabs) {
        return "Retry{}";
    }

    @Override
    public String visit(Next n, Integer tabs) {
        return oneLine(n, "expr", raw(n.expr(), tabs + 1));
    }

    @Override
    public String visit(Return n, Integer tabs) {
        return oneLine(n, "expr", raw(n.expr(), tabs + 1));
    }

    @Override
    public String visit(Yield n, Integer tabs) {
        StringBuilder buf = open(n);
        list(buf, tabs, "args", n.args());
        return close(buf, tabs);
    }

    @Override
    public String visit(RescueCase n, Integer tabs) {
        StringBuilder buf = open(n);
        list(buf, tabs, "exceptions", n.exceptions());
        field(buf, tabs, "var", raw(n.var(), tabs + 1));
        field(buf, tabs, "body", raw(n.body(), tabs + 1));
        return close(buf, tabs);
    }

    @Override
    public String visit(Rescue n, Integer tabs) {
        StringBuilder buf = open(n);
        field(buf, tabs, "body", raw(n.body(), tabs + 1));
        list(buf, tabs, "rescueCases", n.rescueCases());
        field(buf, tabs, "else", raw(n.elseBranch(), tabs + 1));
        field(buf, tabs, "ensure", raw(n.ensure(), tabs + 1));
        return close(buf, tabs);
    }

    @Override
    public String visit(Field n, Integer tabs) {
        StringBuilder buf = open(n);
        field(buf, tabs, "symbol", n.symbol().showName(gs));
        return close(buf, tabs);
    }

    @Override
    public String visit(Local n, Integer tabs) {
        StringBuilder buf = open(n);
        field(buf, tabs, "localVariable", n.localVariable().show(gs));
        return close(buf, tabs);
    }

    @Override
    public String visit(UnresolvedIdent n, Integer tabs) {
        StringBuilder buf = open(n);
        field(buf, tabs, "kind", switch (n.kind()) {
            case LOCAL -> "Local";
            case INSTANCE -> "Instance";
            case CLASS -> "Class";
            case GLOBAL -> "Global";
        });
        field(buf, tabs, "name", n.name().show(gs));
        return close(buf, tabs);
    }

    @Override
    public String visit(RestArg n, Integer tabs) {
        return oneLine(n, "expr", raw(n.expr(), tabs + 1));
    }

    @Override
    public String visit(KeywordArg n, Integer tabs) {
        return oneLine(n, "expr", raw(n.expr(), tabs + 1));
    }

    @Override
    public String visit(OptionalArg n, Integer tabs) {
        StringBuilder buf = open(n);
        field(buf, tabs, "expr", raw(n.expr(), tabs + 1));
        field(buf, tabs, "default", raw(n.defaultValue(), tabs + 1));
        return close(buf, tabs);
    }

    @Override
    public String visit(BlockArg n, Integer tabs) {
        return oneLine(n, "expr", raw(n.expr(), tabs + 1));
    }

    @Override
    public String visit(ShadowArg n, Integer tabs) {
        return oneLine(n, "expr", raw(n.expr(), tabs + 1));
    }

    @Override
    public String visit(Assign n, Integer tabs) {
        StringBuilder buf = open(n);
        field(buf, tabs, "lhs", raw(n.lhs(), tabs + 1));
        field(buf, tabs, "rhs", raw(n.rhs(), tabs + 1));
        return close(buf, tabs);
    }

    @Override
    public String visit(Send n, Integer tabs) {
        StringBuilder buf = open(n);
        field(buf, tabs, "recv", raw(n.recv(), tabs + 1));
        field(buf, tabs, "fun", n.fun().show(gs));
        field(buf, tabs, "block", n.block() == null ? "nullptr" : raw(n.block(), tabs + 1));
        list(buf, tabs, "args", n.args());
        return close(buf, tabs);
    }

    @Override
    public String visit(Cast n, Integer tabs) {
        StringBuilder buf = open(n);
        field(buf, tabs, "cast", n.cast().show(gs));
        field(buf, tabs, "arg", raw(n.arg(), tabs + 1));
        field(buf, tabs, "type", n.castType().show(gs));
        return close(buf, tabs);
    }

    @Override
    public String visit(Hash n, Integer tabs) {
        StringBuilder buf = open(n);
        printTabs(buf, tabs + 1);
        buf.append("pairs = [\n");
        for (int i = 0; i < n.keys().size(); i++) {
            printTabs(buf, tabs + 2);
            buf.append("[\n");
            printTabs(buf, tabs + 3);
            buf.append("key = ").append(raw(n.keys().get(i), tabs + 3)).append('\n');
            printTabs(buf, tabs + 3);
            buf.append("value = ").append(raw(n.values().get(i), tabs + 3)).append('\n');
            printTabs(buf, tabs + 2);
            buf.append("]\n");
        }
        printTabs(buf, tabs + 1);
        buf.append("]\n");
        return close(buf, tabs);
    }

    @Override
    public String visit(Array n, Integer tabs) {
        StringBuilder buf = open(n);
        list(buf, tabs, "elems", n.elems());
        return close(buf, tabs);
    }

    @Override
    public String visit(Literal n, Integer tabs) {
        return oneLine(n, "value", n.value().show(gs));
    }

    @Override
    public String visit(UnresolvedConstantLit n, Integer tabs) {
        StringBuilder buf = open(n);
        field(buf, tabs, "scope", raw(n.scope(), tabs + 1));
        field(buf, tabs, "cnst", n.cnst().show(gs));
        return close(buf, tabs);
    }

    @Override
    public String visit(ConstantLit n, Integer tabs) {
        StringBuilder buf = open(n);
        field(buf, tabs, "orig", n.original() == null ? "nullptr" : raw(n.original(), tabs + 1));
        field(buf, tabs, "symbol", n.symbol().showFullName(gs));
        field(buf, tabs, "typeAlias", raw(n.typeAlias(), tabs + 1));
        return close(buf, tabs);
    }

    @Override
    public String visit(ZSuperArgs n, Integer tabs) {
        return "ZSuperArgs{ }";
    }

    @Override
    public String visit(Self n, Integer tabs) {
        return oneLine(n, "claz", n.claz().showName(gs));
    }

    @Override
    public String visit(Block n, Integer tabs) {
        StringBuilder buf = open(n);
        list(buf, tabs, "args", n.args());
        field(buf, tabs, "body", raw(n.body(), tabs + 1));
        return close(buf, tabs);
    }

    @Override
    public String visit(InsSeq n, Integer tabs) {
        StringBuilder buf = open(n);
        list(buf, tabs, "stats", n.stats());
        field(buf, tabs, "expr", raw(n.expr(), tabs + 1));
        return close(buf, tabs);
    }

    @Override
    public String visit(EmptyTree n, Integer tabs) {
        return "EmptyTree";
    }
}
