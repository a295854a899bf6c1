package com.rubyast.ast.visitor;

import com.rubyast.Trees;
import com.rubyast.ast.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionVisitorTest {

    /**
     * Records the name of the visit overload that fired.
     */
    private static final class WhichBranch implements ExpressionVisitor<String, List<String>> {
        @Override
        public String visit(ClassDef n, List<String> fired) {
            fired.add("ClassDef");
            return "ClassDef";
        }

        @Override
        public String visit(MethodDef n, List<String> fired) {
            fired.add("MethodDef");
            return "MethodDef";
        }

        @Override
        public String visit(If n, List<String> fired) {
            fired.add("If");
            return "If";
        }

        @Override
        public String visit(While n, List<String> fired) {
            fired.add("While");
            return "While";
        }

        @Override
        public String visit(Break n, List<String> fired) {
            fired.add("Break");
            return "Break";
        }

        @Override
        public String visit(Retry n, List<String> fired) {
            fired.add("Retry");
            return "Retry";
        }

        @Override
        public String visit(Next n, List<String> fired) {
            fired.add("Next");
            return "Next";
        }

        @Override
        public String visit(Return n, List<String> fired) {
            fired.add("Return");
            return "Return";
        }

        @Override
        public String visit(Yield n, List<String> fired) {
            fired.add("Yield");
            return "Yield";
        }

        @Override
        public String visit(RescueCase n, List<String> fired) {
            fired.add("RescueCase");
            return "RescueCase";
        }

        @Override
        public String visit(Rescue n, List<String> fired) {
            fired.add("Rescue");
            return "Rescue";
        }

        @Override
        public String visit(Field n, List<String> fired) {
            fired.add("Field");
            return "Field";
        }

        @Override
        public String visit(Local n, List<String> fired) {
            fired.add("Local");
            return "Local";
        }

        @Override
        public String visit(UnresolvedIdent n, List<String> fired) {
            fired.add("UnresolvedIdent");
            return "UnresolvedIdent";
        }

        @Override
        public String visit(RestArg n, List<String> fired) {
            fired.add("RestArg");
            return "RestArg";
        }

        @Override
        public String visit(KeywordArg n, List<String> fired) {
            fired.add("KeywordArg");
            return "KeywordArg";
        }

        @Override
        public String visit(OptionalArg n, List<String> fired) {
            fired.add("OptionalArg");
            return "OptionalArg";
        }

        @Override
        public String visit(BlockArg n, List<String> fired) {
            fired.add("BlockArg");
            return "BlockArg";
        }

        @Override
        public String visit(ShadowArg n, List<String> fired) {
            fired.add("ShadowArg");
            return "ShadowArg";
        }

        @Override
        public String visit(Assign n, List<String> fired) {
            fired.add("Assign");
            return "Assign";
        }

        @Override
        public String visit(Send n, List<String> fired) {
            fired.add("Send");
            return "Send";
        }

        @Override
        public String visit(Cast n, List<String> fired) {
            fired.add("Cast");
            return "Cast";
        }

        @Override
        public String visit(Hash n, List<String> fired) {
            fired.add("Hash");
            return "Hash";
        }

        @Override
        public String visit(Array n, List<String> fired) {
            fired.add("Array");
            return "Array";
        }

        @Override
        public String visit(Literal n, List<String> fired) {
            fired.add("Literal");
            return "Literal";
        }

        @Override
        public String visit(UnresolvedConstantLit n, List<String> fired) {
            fired.add("UnresolvedConstantLit");
            return "UnresolvedConstantLit";
        }

        @Override
        public String visit(ConstantLit n, List<String> fired) {
            fired.add("ConstantLit");
            return "ConstantLit";
        }

        @Override
        public String visit(ZSuperArgs n, List<String> fired) {
            fired.add("ZSuperArgs");
            return "ZSuperArgs";
        }

        @Override
        public String visit(Self n, List<String> fired) {
            fired.add("Self");
            return "Self";
        }

        @Override
        public String visit(Block n, List<String> fired) {
            fired.add("Block");
            return "Block";
        }

        @Override
        public String visit(InsSeq n, List<String> fired) {
            fired.add("InsSeq");
            return "InsSeq";
        }

        @Override
        public String visit(EmptyTree n, List<String> fired) {
            fired.add("EmptyTree");
            return "EmptyTree";
        }

    }

    @Test
    void testEveryVariantDispatchesToExactlyOneBranch() {
        Trees t = new Trees();
        List<Expression> all = t.oneOfEach();
        assertEquals(32, all.size());

        Set<String> seen = new HashSet<>();
        for (Expression e : all) {
            List<String> fired = new ArrayList<>();
            String branch = e.accept(new WhichBranch(), fired);
            assertEquals(List.of(e.type()), fired, "exactly one branch for " + e.type());
            assertEquals(e.getClass().getSimpleName(), branch);
            seen.add(branch);
        }
        assertEquals(32, seen.size(), "every variant has its own branch");
    }

    @Test
    void testDefaultsRouteUnhandledVariantsToDefaultAction() {
        Trees t = new Trees();
        ExpressionVisitorWithDefaults<String, Void> onlySends = new ExpressionVisitorWithDefaults<>() {
            @Override
            public String visit(Send n, Void arg) {
                return "send";
            }

            @Override
            public String defaultAction(Expression n, Void arg) {
                return "other:" + n.type();
            }
        };

        assertEquals("send", t.call("foo").accept(onlySends, null));
        assertEquals("other:Literal", t.integer(1).accept(onlySends, null));
        assertEquals("other:EmptyTree", Nodes.emptyTree().accept(onlySends, null));
    }

    @Test
    void testTypecaseFirstMatchAndFallback() {
        Trees t = new Trees();
        Expression send = t.call("foo");

        String result = Typecase.<String>of(send)
            .when(Reference.class, r -> "reference")
            .when(Send.class, s -> "send " + t.gs.nameText(s.fun()))
            .when(Expression.class, e -> "any")
            .orElse(e -> "fallback");
        assertEquals("send foo", result);

        String fallback = Typecase.<String>of(t.integer(1))
            .when(Send.class, s -> "send")
            .orElse(e -> "fallback " + e.type());
        assertEquals("fallback Literal", fallback);

        assertSame(send, Typecase.cast(Send.class, send));
        assertNull(Typecase.cast(Assign.class, send));
        assertTrue(Typecase.isa(Reference.class, t.local("x")));
    }
}
