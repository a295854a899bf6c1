package com.rubyast.dsl;

import com.rubyast.Trees;
import com.rubyast.ast.*;
import com.rubyast.ast.verifier.Verifier;
import com.rubyast.common.InvariantViolationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DSLReplacerTest {

    private static ClassDef runOn(Trees t, ClassDef classDef) {
        return (ClassDef) DSL.run(t.ctx, classDef);
    }

    private static List<String> shapes(Trees t, ClassDef classDef) {
        List<String> result = new ArrayList<>();
        for (Expression stat : classDef.rhs()) {
            if (stat instanceof MethodDef) {
                result.add("def " + t.gs.nameText(((MethodDef) stat).name()));
            } else if (stat instanceof Send) {
                result.add("send " + t.gs.nameText(((Send) stat).fun()));
            } else {
                result.add(stat.type());
            }
        }
        return result;
    }

    @Test
    void testUntouchedClassIsReturnedAsIs() {
        Trees t = new Trees();
        ClassDef in = t.cls("Foo", t.call("foo"), t.def("bar", t.integer(1)),
            t.assign(t.ivar("@x"), t.integer(1)));
        assertSame(in, DSL.run(t.ctx, in));
        assertFalse(t.ctx.hasErrors());
    }

    @Test
    void testSingleFieldAssignmentIsReturnedAsIs() {
        Trees t = new Trees();
        Assign assign = t.assign(new Field(t.loc(), t.gs.enterSymbol("Foo::x")), t.integer(1));
        ClassDef in = t.cls("Foo", assign);

        Expression out = DSL.run(t.ctx, in);

        assertSame(in, out);
        assertEquals(List.of(assign), ((ClassDef) out).rhs());
        assertSame(assign, ((ClassDef) out).rhs().get(0));
        assertFalse(t.ctx.hasErrors());
    }

    @Test
    void testReplacementIsSplicedInPlace() {
        Trees t = new Trees();
        ClassDef out = runOn(t, t.cls("Foo",
            t.call("before"),
            t.call("prop", t.sym("foo"), t.cnst("String")),
            t.call("after")));
        assertEquals(List.of("send before", "def foo", "def foo=", "send after"), shapes(t, out));
        Verifier.run(out);
    }

    @Test
    void testEveryMatchingStatementIsReplaced() {
        Trees t = new Trees();
        ClassDef out = runOn(t, t.cls("Foo",
            t.call("const", t.sym("a"), t.cnst("String")),
            t.call("prop", t.sym("b"), t.cnst("Integer")),
            t.call("const", t.sym("c"), t.cnst("String"))));
        assertEquals(List.of("def a", "def b", "def b=", "def c"), shapes(t, out));
    }

    @Test
    void testEqualStatementsAreEachReplaced() {
        Trees t = new Trees();
        ClassDef out = runOn(t, t.cls("Foo",
            t.call("const", t.sym("a"), t.cnst("String")),
            t.call("other"),
            t.call("const", t.sym("a"), t.cnst("String"))));
        assertEquals(List.of("def a", "send other", "def a"), shapes(t, out));
    }

    @Test
    void testFirstMatchingRuleWins() {
        Trees t = new Trees();
        List<String> calls = new ArrayList<>();
        DslRuleSet rules = DslRuleSet.builder()
            .statementRule(Send.class, "declines", (ctx, stat, prev) -> {
                calls.add("declines");
                return List.of();
            })
            .statementRule(Send.class, "first", (ctx, stat, prev) -> {
                calls.add("first");
                return List.of(Nodes.nil(stat.loc()));
            })
            .statementRule(Send.class, "second", (ctx, stat, prev) -> {
                calls.add("second");
                return List.of(Nodes.trueLit(stat.loc()));
            })
            .build();

        ClassDef out = (ClassDef) DSL.run(t.ctx, t.cls("Foo", t.call("x")), rules, RewriteObserver.NONE);

        assertEquals(List.of("declines", "first"), calls);
        assertEquals(1, out.rhs().size());
        assertTrue(((Literal) out.rhs().get(0)).isNil());
    }

    @Test
    void testRulesOnlySeeTheirStatementKind() {
        Trees t = new Trees();
        List<String> seen = new ArrayList<>();
        DslRuleSet rules = DslRuleSet.builder()
            .statementRule(MethodDef.class, "methods", (ctx, stat, prev) -> {
                seen.add(t.gs.nameText(stat.name()));
                return List.of();
            })
            .build();
        DSL.run(t.ctx, t.cls("Foo", t.call("x"), t.def("m", t.integer(1)), t.integer(2)), rules, RewriteObserver.NONE);
        assertEquals(List.of("m"), seen);
    }

    @Test
    void testPreviousStatementIsTheOriginalOne() {
        Trees t = new Trees();
        Send first = t.call("prop", t.sym("a"), t.cnst("String"));
        Send second = t.call("b");
        Send third = t.call("c");
        List<Expression> prevs = new ArrayList<>();
        DslRuleSet rules = DslRuleSet.builder()
            .statementRule(Send.class, "recorder", (ctx, stat, prev) -> {
                prevs.add(prev);
                return stat == first ? List.of(Nodes.nil(stat.loc())) : List.of();
            })
            .build();

        DSL.run(t.ctx, t.cls("Foo", first, second, third), rules, RewriteObserver.NONE);

        assertEquals(3, prevs.size());
        assertInstanceOf(EmptyTree.class, prevs.get(0));
        assertSame(first, prevs.get(1));
        assertSame(second, prevs.get(2));
    }

    @Test
    void testObserverHearsAboutEachReplacement() {
        Trees t = new Trees();
        List<String> events = new ArrayList<>();
        RewriteObserver observer = (ruleName, statement, count) -> events.add(ruleName + ":" + statement.type() + ":" + count);

        DSL.run(t.ctx, t.cls("Foo",
            t.call("prop", t.sym("a"), t.cnst("String")),
            t.call("nothing"),
            t.call("attr_reader", t.sym("b"), t.sym("c"))), DslRuleSet.standard(), observer);

        assertEquals(List.of("ChalkODMProp:Send:2", "AttrReader:Send:2"), events);
    }

    @Test
    void testNestedClassesAreRewritten() {
        Trees t = new Trees();
        ClassDef inner = t.cls("Inner", t.call("prop", t.sym("a"), t.cnst("String")));
        ClassDef out = runOn(t, t.cls("Outer", t.call("prop", t.sym("b"), t.cnst("String")), inner));

        assertEquals(List.of("def b", "def b=", "ClassDef"), shapes(t, out));
        assertEquals(List.of("def a", "def a="), shapes(t, (ClassDef) out.rhs().get(2)));
    }

    @Test
    void testClassesInsideMethodBodiesAreRewritten() {
        Trees t = new Trees();
        ClassDef inner = t.cls("Inner", t.call("const", t.sym("a"), t.cnst("String")));
        Expression out = DSL.run(t.ctx, Nodes.insSeq(t.loc(), List.of(inner), t.call("done")));

        ClassDef rewritten = (ClassDef) ((InsSeq) out).stats().get(0);
        assertEquals(List.of("def a"), shapes(t, rewritten));
    }

    @Test
    void testSecondRunIsANoOp() {
        Trees t = new Trees();
        ClassDef once = runOn(t, t.cls("Foo",
            t.call("prop", t.sym("a"), t.cnst("String")),
            t.call("attr_accessor", t.sym("b")),
            t.call("dsl_optional", t.sym("c"), t.cnst("String"))));
        String shown = t.show(once);

        Expression twice = DSL.run(t.ctx, once);

        assertSame(once, twice);
        assertEquals(shown, t.show(twice));
    }

    @Test
    void testRewrittenTreesPassTheVerifier() {
        Trees t = new Trees();
        Send sig = t.call("sig").withBlock(t.block(t.call("returns", t.cnst("Integer"))));
        ClassDef in = t.clsExtending("Cmd", List.of(t.cnst("Opus", "Command")),
            t.call("prop", t.sym("a"), t.cnst("String")),
            t.call("encrypted_prop", t.sym("secret")),
            t.call("dsl_required", t.sym("d"), t.cnst("String")),
            sig,
            t.call("attr_reader", t.sym("r")),
            t.assign(t.cnst("Point"), t.callOn(t.cnst("Struct"), "new", t.sym("x"), t.sym("y"))),
            t.defSelf("registered", t.callOn(t.local("app"), "helpers", t.cnst("Helpers")), t.local("app")),
            t.def("call", t.callOn(t.cnst("Iface"), "wrap_instance", t.local("x")), t.local("x")));

        ClassDef out = (ClassDef) Verifier.run(DSL.run(t.ctx, in));

        assertEquals(List.of(
            "def a", "def a=",
            "def secret", "def encrypted_secret", "def secret=", "def encrypted_secret=",
            "def d", "def get_d",
            "send sig",
            "def r",
            "ClassDef",
            "def registered", "send include",
            "def call", "def call"), shapes(t, out));
        assertFalse(t.ctx.hasErrors());
    }

    @Test
    void testNullRuleResultIsFatal() {
        Trees t = new Trees();
        DslRuleSet rules = DslRuleSet.builder()
            .statementRule(Send.class, "broken", (ctx, stat, prev) -> null)
            .build();
        assertThrows(InvariantViolationException.class,
            () -> DSL.run(t.ctx, t.cls("Foo", t.call("x")), rules, RewriteObserver.NONE));
    }
}
