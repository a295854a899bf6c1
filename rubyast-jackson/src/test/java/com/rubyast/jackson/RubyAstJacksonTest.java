package com.rubyast.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rubyast.ast.*;
import com.rubyast.ast.visitor.Children;
import com.rubyast.ast.visitor.ExpressionVisitorWithDefaults;
import com.rubyast.core.FileRef;
import com.rubyast.core.Loc;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class RubyAstJacksonTest {

    private final ObjectMapper mapper = RubyAstJackson.createObjectMapper();

    private static Set<String> variantsIn(Expression tree) {
        Set<String> seen = new HashSet<>();
        tree.accept(new ExpressionVisitorWithDefaults<Void, Void>() {
            @Override
            public Void defaultAction(Expression n, Void arg) {
                seen.add(n.type());
                for (Expression child : Children.of(n)) {
                    child.accept(this, arg);
                }
                return null;
            }
        }, null);
        return seen;
    }

    @Test
    void testSampleCoversEveryVariant() {
        assertEquals(32, variantsIn(new SampleTrees().everything()).size());
    }

    @Test
    void testRoundTrip() throws Exception {
        ClassDef tree = new SampleTrees().everything();

        String json = mapper.writeValueAsString(tree);
        Expression back = mapper.readValue(json, Expression.class);

        assertEquals(tree, back);
        assertEquals(json, mapper.writeValueAsString(back));
    }

    @Test
    void testTypeAndKindDiscriminators() throws Exception {
        SampleTrees s = new SampleTrees();
        JsonNode node = mapper.readTree(mapper.writeValueAsString(Nodes.symbol(s.loc(), SampleTrees.name(7))));

        assertEquals("Literal", node.get("type").asText());
        assertEquals("Symbol", node.get("value").get("kind").asText());
        assertTrue(node.get("value").get("value").isInt());
        assertEquals(7, node.get("value").get("value").asInt());
        assertEquals(3, node.get("loc").get("file").asInt());
        assertFalse(node.has("symbol"));
    }

    @Test
    void testDerivedAccessorsAreNotWritten() throws Exception {
        SampleTrees s = new SampleTrees();
        JsonNode method = mapper.readTree(mapper.writeValueAsString(
            Nodes.method0(s.loc(), SampleTrees.name(1), Nodes.emptyTree(), MethodDef.SELF_METHOD)));

        assertEquals(MethodDef.SELF_METHOD, method.get("flags").asInt());
        assertFalse(method.has("self"));
        assertFalse(method.has("dslsynthesized"));
        assertFalse(method.has("DSLSynthesized"));
        assertEquals("EmptyTree", method.get("rhs").get("type").asText());
    }

    @Test
    void testAbsentBlockIsWrittenAsNull() throws Exception {
        SampleTrees s = new SampleTrees();
        JsonNode send = mapper.readTree(mapper.writeValueAsString(s.call(1)));

        assertTrue(send.has("block"));
        assertTrue(send.get("block").isNull());
    }

    @Test
    void testUnresolvedConstantKeepsOriginal() throws Exception {
        SampleTrees s = new SampleTrees();
        ConstantLit constant = new ConstantLit(s.loc(), null, s.cnst(5), null);

        ConstantLit back = mapper.readValue(mapper.writeValueAsString(constant), ConstantLit.class);

        assertEquals(ConstantLit.Kind.UNRESOLVED, back.resolution());
        assertEquals(constant.original(), back.original());
    }

    @Test
    void testReadsHandWrittenJson() throws Exception {
        String json = """
            {
              "type": "Assign",
              "loc": { "file": 1, "beginPos": 0, "endPos": 6 },
              "lhs": { "type": "UnresolvedIdent", "loc": { "file": 1, "beginPos": 0, "endPos": 2 },
                       "kind": "INSTANCE", "name": 4 },
              "rhs": { "type": "Literal", "loc": { "file": 1, "beginPos": 5, "endPos": 6 },
                       "value": { "kind": "Integer", "value": 1 } }
            }""";

        Assign assign = (Assign) mapper.readValue(json, Expression.class);

        assertEquals(new Loc(new FileRef(1), 0, 6), assign.loc());
        assertEquals(UnresolvedIdent.Kind.INSTANCE, ((UnresolvedIdent) assign.lhs()).kind());
        assertEquals(new LiteralValue.IntegerValue(1), ((Literal) assign.rhs()).value());
    }

    @Test
    void testEmptyRoots() throws Exception {
        assertEquals(new EmptyTree(), mapper.readValue("{\"type\":\"EmptyTree\"}", Expression.class));
        Array empty = new Array(new SampleTrees().loc(), List.of());
        assertEquals(empty, mapper.readValue(mapper.writeValueAsString(empty), Expression.class));
    }
}
