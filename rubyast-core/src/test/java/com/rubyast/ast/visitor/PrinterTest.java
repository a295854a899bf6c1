package com.rubyast.ast.visitor;

import com.rubyast.Trees;
import com.rubyast.ast.*;
import com.rubyast.core.LocalVariable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PrinterTest {

    private static ClassDef sample(Trees t) {
        return t.cls("Foo",
            t.call("prop", t.sym("foo"), t.cnst("String")),
            t.def("bar", t.integer(1)));
    }

    @Test
    void testShowRawSnapshot() {
        Trees t = new Trees();
        String expected = """
            ClassDef{
              kind = class
              name = UnresolvedConstantLit{
                scope = EmptyTree
                cnst = Foo
              }<<todo sym>>
              ancestors = []
              rhs = [
                Send{
                  recv = Self{ claz = <todo sym> }
                  fun = prop
                  block = nullptr
                  args = [
                    Literal{ value = :foo }
                    UnresolvedConstantLit{
                      scope = EmptyTree
                      cnst = String
                    }
                  ]
                }

                MethodDef{
                  flags = 0
                  name = bar<<todo sym>>
                  args = []
                  rhs = Literal{ value = 1 }
                }
              ]
            }""";
        assertEquals(expected, t.raw(sample(t)));
    }

    @Test
    void testToStringSnapshot() {
        Trees t = new Trees();
        String expected = """
            class <emptyTree>::Foo<<todo sym>> < ()
              self(TODO).prop(:foo, <emptyTree>::String)

              def bar<<todo sym>>()
                1
              end
            end""";
        assertEquals(expected, t.show(sample(t)));
    }

    @Test
    void testToStringOfSmallExpressions() {
        Trees t = new Trees();
        assertEquals("{:k => \"v\"}", t.show(new Hash(t.loc(), List.of(t.sym("k")), List.of(t.str("v")))));
        assertEquals("[5, true]", t.show(new Array(t.loc(), List.of(t.integer(5), Nodes.trueLit(t.loc())))));
        assertEquals("T.let(x, Integer)", t.show(new Cast(t.loc(), t.gs.enterType("Integer"), t.local("x"), t.name("let"))));
        assertEquals("x$1", t.show(new Local(t.loc(), new LocalVariable(t.name("x"), 1))));
        assertEquals("x", t.show(new Local(t.loc(), new LocalVariable(t.name("x"), 0))));
        assertEquals("recv.each() do ||\n  it\nend",
            t.show(Nodes.send(t.loc(), t.local("recv"), t.name("each"), List.of(), t.block(t.local("it")))));
        assertEquals("<emptyTree>", t.show(Nodes.emptyTree()));
    }

    @Test
    void testConstantLitShowsItsAuthoritativeForm() {
        Trees t = new Trees();
        ConstantLit resolved = new ConstantLit(t.loc(), t.gs.enterSymbol("Opus::Command"), t.cnst("Opus", "Command"), null);
        ConstantLit unresolved = new ConstantLit(t.loc(), null, t.cnst("Opus", "Command"), null);
        ConstantLit alias = new ConstantLit(t.loc(), null, null, t.cnst("Integer"));

        assertEquals("Opus::Command", t.show(resolved));
        assertEquals("Unresolved: <emptyTree>::Opus::Command", t.show(unresolved));
        assertEquals("<emptyTree>::Integer", t.show(alias));
    }

    @Test
    void testMethodFlagsInRawDump() {
        Trees t = new Trees();
        MethodDef m = Nodes.method0(t.loc(), t.name("call"), Nodes.emptyTree(),
            MethodDef.SELF_METHOD | MethodDef.DSL_SYNTHESIZED);
        assertTrue(t.raw(m).contains("flags = self dsl\n"), t.raw(m));
        assertTrue(t.show(m).startsWith("def self.call<<todo sym>>()"), t.show(m));
    }
}
