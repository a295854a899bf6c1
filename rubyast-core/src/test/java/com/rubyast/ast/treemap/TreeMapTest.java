package com.rubyast.ast.treemap;

import com.rubyast.Trees;
import com.rubyast.ast.*;
import com.rubyast.common.InvariantViolationException;
import com.rubyast.core.MutableContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeMapTest {

    private static final TreeTransformer<MutableContext> IDENTITY = new TreeTransformer<>() {
    };

    @Test
    void testIdentityTransformKeepsEveryNode() {
        Trees t = new Trees();
        for (Expression tree : t.oneOfEach()) {
            assertSame(tree, TreeMap.apply(t.ctx, IDENTITY, tree), tree.type());
        }
    }

    @Test
    void testHooksRunPreOrderThenBottomUp() {
        Trees t = new Trees();
        ClassDef tree = t.cls("Foo", t.def("bar", t.call("baz")));
        List<String> events = new ArrayList<>();

        TreeMap.apply(t.ctx, new TreeTransformer<MutableContext>() {
            @Override
            public ClassDef preTransformClassDef(MutableContext ctx, ClassDef original) {
                events.add("pre ClassDef");
                return original;
            }

            @Override
            public MethodDef preTransformMethodDef(MutableContext ctx, MethodDef original) {
                events.add("pre MethodDef");
                return original;
            }

            @Override
            public Expression postTransformSend(MutableContext ctx, Send original) {
                events.add("post Send");
                return original;
            }

            @Override
            public Expression postTransformMethodDef(MutableContext ctx, MethodDef original) {
                events.add("post MethodDef");
                return original;
            }

            @Override
            public Expression postTransformClassDef(MutableContext ctx, ClassDef original) {
                events.add("post ClassDef");
                return original;
            }
        }, tree);

        assertEquals(List.of("pre ClassDef", "pre MethodDef", "post Send", "post MethodDef", "post ClassDef"), events);
    }

    @Test
    void testReplacementRebuildsOnlyTheSpine() {
        Trees t = new Trees();
        Send untouched = t.call("keep");
        Literal target = t.integer(1);
        MethodDef method = t.def("m", target);
        ClassDef tree = t.cls("Foo", untouched, method);

        Expression result = TreeMap.apply(t.ctx, new TreeTransformer<MutableContext>() {
            @Override
            public Expression postTransformLiteral(MutableContext ctx, Literal original) {
                if (original == target) {
                    return Nodes.integer(original.loc(), 2);
                }
                return original;
            }
        }, tree);

        ClassDef classDef = assertInstanceOf(ClassDef.class, result);
        assertNotSame(tree, classDef);
        assertEquals(tree.loc(), classDef.loc());
        assertSame(untouched, classDef.rhs().get(0));
        MethodDef newMethod = assertInstanceOf(MethodDef.class, classDef.rhs().get(1));
        assertNotSame(method, newMethod);
        assertEquals(method.loc(), newMethod.loc());
        assertEquals(Nodes.integer(target.loc(), 2), newMethod.rhs());
    }

    @Test
    void testPostHookMayReplaceClassDefWithAnotherVariant() {
        Trees t = new Trees();
        Expression tree = Nodes.insSeq(t.loc(), List.of(t.cls("Foo")), t.integer(1));

        Expression result = TreeMap.apply(t.ctx, new TreeTransformer<MutableContext>() {
            @Override
            public Expression postTransformClassDef(MutableContext ctx, ClassDef original) {
                return Nodes.emptyTree();
            }
        }, tree);

        InsSeq seq = assertInstanceOf(InsSeq.class, result);
        assertInstanceOf(EmptyTree.class, seq.stats().get(0));
    }

    @Test
    void testNullFromHookIsFatal() {
        Trees t = new Trees();
        TreeTransformer<MutableContext> broken = new TreeTransformer<>() {
            @Override
            public Expression postTransformSend(MutableContext ctx, Send original) {
                return null;
            }
        };
        assertThrows(InvariantViolationException.class, () -> TreeMap.apply(t.ctx, broken, t.cls("Foo", t.call("x"))));
    }

    @Test
    void testBlockSlotMustStayABlock() {
        Trees t = new Trees();
        Send send = Nodes.send(t.loc(), t.self(), t.name("each"), List.of(), t.block(t.integer(1)));
        TreeTransformer<MutableContext> broken = new TreeTransformer<>() {
            @Override
            public Expression postTransformBlock(MutableContext ctx, Block original) {
                return original.body();
            }
        };
        assertThrows(InvariantViolationException.class, () -> TreeMap.apply(t.ctx, broken, send));
    }

    @Test
    void testArgumentSlotMustStayAReference() {
        Trees t = new Trees();
        MethodDef method = t.def("m", t.integer(1), t.local("a"));
        TreeTransformer<MutableContext> broken = new TreeTransformer<>() {
            @Override
            public Expression postTransformUnresolvedIdent(MutableContext ctx, UnresolvedIdent original) {
                return Nodes.nil(original.loc());
            }
        };
        assertThrows(InvariantViolationException.class, () -> TreeMap.apply(t.ctx, broken, method));
    }

    @Test
    void testConstantLitOriginalIsNotVisited() {
        Trees t = new Trees();
        ConstantLit constant = new ConstantLit(t.loc(), null, t.cnst("Foo"), null);
        List<Expression> visited = new ArrayList<>();

        TreeMap.apply(t.ctx, new TreeTransformer<MutableContext>() {
            @Override
            public Expression postTransformUnresolvedConstantLit(MutableContext ctx, UnresolvedConstantLit original) {
                visited.add(original);
                return original;
            }
        }, constant);

        assertTrue(visited.isEmpty());
    }
}
