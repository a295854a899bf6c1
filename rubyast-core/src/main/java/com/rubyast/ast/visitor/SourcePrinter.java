package com.rubyast.ast.visitor;

import com.rubyast.ast.*;
import com.rubyast.core.GlobalState;
import com.rubyast.core.SymbolRef;

import java.util.List;

/**
 * Renders a tree as Ruby-like text. Intended for humans; the format may change.
 * Use {@link RawPrinter} for a stable structural dump.
 */
public final class SourcePrinter implements ExpressionVisitor<String, Integer> {

    private final GlobalState gs;

    private SourcePrinter(GlobalState gs) {
        this.gs = gs;
    }

    public static String print(GlobalState gs, Expression tree) {
        return tree.accept(new SourcePrinter(gs), 0);
    }

    private String print(Expression e, int tabs) {
        return e.accept(this, tabs);
    }

    static void printTabs(StringBuilder to, int count) {
        for (int i = 0; i < count; i++) {
            to.append("  ");
        }
    }

    private void printElems(StringBuilder buf, List<? extends Expression> args, int tabs) {
        boolean first = true;
        boolean didShadow = false;
        for (Expression a : args) {
            if (!first) {
                if (a instanceof ShadowArg && !didShadow) {
                    buf.append("; ");
                    didShadow = true;
                } else {
                    buf.append(", ");
                }
            }
            first = false;
            buf.append(print(a, tabs + 1));
        }
    }

    private void printArgs(StringBuilder buf, List<? extends Expression> args, int tabs) {
        buf.append('(');
        printElems(buf, args, tabs);
        buf.append(')');
    }

    @Override
    public String visit(ClassDef n, Integer tabs) {
        StringBuilder buf = new StringBuilder();
        buf.append(n.kind() == ClassDefKind.MODULE ? "module " : "class ");
        buf.append(print(n.name(), tabs)).append('<').append(n.symbol().showName(gs)).append("> < ");
        printArgs(buf, n.ancestors(), tabs);
        for (Expression stat : n.rhs()) {
            buf.append('\n');
            printTabs(buf, tabs + 1);
            buf.append(print(stat, tabs + 1)).append('\n');
        }
        printTabs(buf, tabs);
        buf.append("end");
        return buf.toString();
    }

    @Override
    public String visit(MethodDef n, Integer tabs) {
        StringBuilder buf = new StringBuilder();
        buf.append(n.isSelf() ? "def self." : "def ");
        buf.append(n.name().show(gs)).append('<').append(n.symbol().showName(gs)).append('>');
        buf.append('(');
        boolean first = true;
        for (Expression a : n.args()) {
            if (!first) {
                buf.append(", ");
            }
            first = false;
            buf.append(print(a, tabs + 1));
        }
        buf.append(")\n");
        printTabs(buf, tabs + 1);
        buf.append(print(n.rhs(), tabs + 1)).append('\n');
        printTabs(buf, tabs);
        buf.append("end");
        return buf.toString();
    }

    @Override
    public String visit(If n, Integer tabs) {
        StringBuilder buf = new StringBuilder();
        buf.append("if ").append(print(n.cond(), tabs + 1)).append('\n');
        printTabs(buf, tabs + 1);
        buf.append(print(n.thenp(), tabs + 1)).append('\n');
        printTabs(buf, tabs);
        buf.append("else\n");
        printTabs(buf, tabs + 1);
        buf.append(print(n.elsep(), tabs + 1)).append('\n');
        printTabs(buf, tabs);
        buf.append("end");
        return buf.toString();
    }

    @Override
    public String visit(While n, Integer tabs) {
        StringBuilder buf = new StringBuilder();
        buf.append("while ").append(print(n.cond(), tabs + 1)).append('\n');
        printTabs(buf, tabs + 1);
        buf.append(print(n.body(), tabs + 1)).append('\n');
        printTabs(buf, tabs);
        buf.append("end");
        return buf.toString();
    }

    @Override
    public String visit(Break n, Integer tabs) {
        return "break(" + print(n.expr(), tabs + 1) + ")";
    }

    @Override
    public String visit(Retry n, Integer tabs) {
        return "retry";
    }

    @Override
    public String visit(Next n, Integer tabs) {
        return "next(" + print(n.expr(), tabs + 1) + ")";
    }

    @Override
    public String visit(Return n, Integer tabs) {
        return "return " + print(n.expr(), tabs + 1);
    }

    @Override
    public String visit(Yield n, Integer tabs) {
        StringBuilder buf = new StringBuilder("yield");
        printArgs(buf, n.args(), tabs);
        return buf.toString();
    }

    @Override
    public String visit(RescueCase n, Integer tabs) {
        StringBuilder buf = new StringBuilder("rescue");
        boolean first = true;
        for (Expression exception : n.exceptions()) {
            buf.append(first ? " " : ", ");
            first = false;
            buf.append(print(exception, tabs));
        }
        buf.append(" => ").append(print(n.var(), tabs)).append('\n');
        printTabs(buf, tabs);
        buf.append(print(n.body(), tabs));
        return buf.toString();
    }

    @Override
    public String visit(Rescue n, Integer tabs) {
        StringBuilder buf = new StringBuilder();
        buf.append(print(n.body(), tabs));
        for (RescueCase rescueCase : n.rescueCases()) {
            buf.append('\n');
            printTabs(buf, tabs - 1);
            buf.append(print(rescueCase, tabs));
        }
        if (!(n.elseBranch() instanceof EmptyTree)) {
            buf.append('\n');
            printTabs(buf, tabs - 1);
            buf.append("else\n");
            printTabs(buf, tabs);
            buf.append(print(n.elseBranch(), tabs));
        }
        if (!(n.ensure() instanceof EmptyTree)) {
            buf.append('\n');
            printTabs(buf, tabs - 1);
            buf.append("ensure\n");
            printTabs(buf, tabs);
            buf.append(print(n.ensure(), tabs));
        }
        return buf.toString();
    }

    @Override
    public String visit(Field n, Integer tabs) {
        return n.symbol().showFullName(gs);
    }

    @Override
    public String visit(Local n, Integer tabs) {
        return n.localVariable().show(gs);
    }

    @Override
    public String visit(UnresolvedIdent n, Integer tabs) {
        return n.name().show(gs);
    }

    @Override
    public String visit(RestArg n, Integer tabs) {
        return "*" + print(n.expr(), tabs);
    }

    @Override
    public String visit(KeywordArg n, Integer tabs) {
        return print(n.expr(), tabs) + ":";
    }

    @Override
    public String visit(OptionalArg n, Integer tabs) {
        return print(n.expr(), tabs) + " = " + print(n.defaultValue(), tabs);
    }

    @Override
    public String visit(BlockArg n, Integer tabs) {
        return "&" + print(n.expr(), tabs);
    }

    @Override
    public String visit(ShadowArg n, Integer tabs) {
        return print(n.expr(), tabs);
    }

    @Override
    public String visit(Assign n, Integer tabs) {
        return print(n.lhs(), tabs) + " = " + print(n.rhs(), tabs);
    }

    @Override
    public String visit(Send n, Integer tabs) {
        StringBuilder buf = new StringBuilder();
        buf.append(print(n.recv(), tabs)).append('.').append(n.fun().show(gs));
        printArgs(buf, n.args(), tabs);
        if (n.block() != null) {
            buf.append(print(n.block(), tabs));
        }
        return buf.toString();
    }

    @Override
    public String visit(Cast n, Integer tabs) {
        return "T." + n.cast().show(gs) + "(" + print(n.arg(), tabs) + ", " + n.castType().show(gs) + ")";
    }

    @Override
    public String visit(Hash n, Integer tabs) {
        StringBuilder buf = new StringBuilder("{");
        for (int i = 0; i < n.keys().size(); i++) {
            if (i > 0) {
                buf.append(", ");
            }
            buf.append(print(n.keys().get(i), tabs + 1));
            buf.append(" => ");
            buf.append(print(n.values().get(i), tabs + 1));
        }
        buf.append('}');
        return buf.toString();
    }

    @Override
    public String visit(Array n, Integer tabs) {
        StringBuilder buf = new StringBuilder("[");
        printElems(buf, n.elems(), tabs);
        buf.append(']');
        return buf.toString();
    }

    @Override
    public String visit(Literal n, Integer tabs) {
        return n.value().show(gs);
    }

    @Override
    public String visit(UnresolvedConstantLit n, Integer tabs) {
        return print(n.scope(), tabs) + "::" + n.cnst().show(gs);
    }

    @Override
    public String visit(ConstantLit n, Integer tabs) {
        switch (n.resolution()) {
            case SYMBOL:
                return n.symbol().showFullName(gs);
            case TYPE_ALIAS:
                return print(n.typeAlias(), tabs);
            default:
                return "Unresolved: " + print(n.original(), tabs);
        }
    }

    @Override
    public String visit(ZSuperArgs n, Integer tabs) {
        return "ZSuperArgs";
    }

    @Override
    public String visit(Self n, Integer tabs) {
        if (n.claz().exists() && !n.claz().equals(SymbolRef.todo())) {
            return "self(" + n.claz().showName(gs) + ")";
        }
        return "self(TODO)";
    }

    @Override
    public String visit(Block n, Integer tabs) {
        StringBuilder buf = new StringBuilder(" do |");
        printElems(buf, n.args(), tabs + 1);
        buf.append("|\n");
        printTabs(buf, tabs + 1);
        buf.append(print(n.body(), tabs + 1)).append('\n');
        printTabs(buf, tabs);
        buf.append("end");
        return buf.toString();
    }

    @Override
    public String visit(InsSeq n, Integer tabs) {
        StringBuilder buf = new StringBuilder("begin\n");
        for (Expression stat : n.stats()) {
            printTabs(buf, tabs + 1);
            buf.append(print(stat, tabs + 1)).append('\n');
        }
        printTabs(buf, tabs + 1);
        buf.append(print(n.expr(), tabs + 1)).append('\n');
        printTabs(buf, tabs);
        buf.append("end");
        return buf.toString();
    }

    @Override
    public String visit(EmptyTree n, Integer tabs) {
        return "<emptyTree>";
    }
}
