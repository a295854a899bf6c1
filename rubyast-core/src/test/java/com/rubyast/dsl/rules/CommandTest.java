package com.rubyast.dsl.rules;

import com.rubyast.Trees;
import com.rubyast.ast.*;
import com.rubyast.ast.verifier.Verifier;
import com.rubyast.dsl.DSL;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CommandTest {

    private final Command rule = new Command();

    @Test
    void testSelfCallIsAddedAfterCall() {
        Trees t = new Trees();
        MethodDef call = t.def("call", t.integer(1), t.local("a"), Nodes.optionalArg(t.loc(), t.local("b"), Nodes.nil(t.loc())));
        ClassDef in = t.clsExtending("MyCommand", List.of(t.cnst("Opus", "Command")),
            t.call("before"), call, t.def("other", t.integer(2)));

        ClassDef out = rule.patch(t.ctx, in);

        assertEquals(4, out.rhs().size());
        assertSame(call, out.rhs().get(1));
        MethodDef selfCall = (MethodDef) out.rhs().get(2);
        assertTrue(selfCall.isSelf());
        assertTrue(selfCall.isDSLSynthesized());
        assertEquals(call.name(), selfCall.name());
        assertEquals(call.args(), selfCall.args());
        assertNotSame(call.args().get(0), selfCall.args().get(0));
        assertInstanceOf(EmptyTree.class, selfCall.rhs());
        assertEquals("def self.call<<todo sym>>(a, b = nil)\n  <emptyTree>\nend", t.show(selfCall));
        Verifier.run(out);
    }

    @Test
    void testResolvedAncestorIsRecognized() {
        Trees t = new Trees();
        ConstantLit ancestor = new ConstantLit(t.loc(), t.gs.enterSymbol("Opus::Command"), null, null);
        ClassDef in = t.clsExtending("MyCommand", List.of(ancestor), t.def("call", t.integer(1)));

        ClassDef out = (ClassDef) DSL.run(t.ctx, in);

        assertEquals(2, out.rhs().size());
        assertTrue(((MethodDef) out.rhs().get(1)).isSelf());
    }

    @Test
    void testExistingSelfCallIsKept() {
        Trees t = new Trees();
        ClassDef in = t.clsExtending("MyCommand", List.of(t.cnst("Opus", "Command")),
            t.def("call", t.integer(1)), t.defSelf("call", t.integer(2)));
        assertSame(in, rule.patch(t.ctx, in));
    }

    @Test
    void testOtherClassesAreUntouched() {
        Trees t = new Trees();
        ClassDef plain = t.cls("Foo", t.def("call", t.integer(1)));
        assertSame(plain, rule.patch(t.ctx, plain));

        ClassDef otherCommand = t.clsExtending("Foo", List.of(t.cnst("Command")), t.def("call", t.integer(1)));
        assertSame(otherCommand, rule.patch(t.ctx, otherCommand));

        ClassDef noCall = t.clsExtending("Foo", List.of(t.cnst("Opus", "Command")), t.def("run", t.integer(1)));
        assertSame(noCall, rule.patch(t.ctx, noCall));
    }
}
