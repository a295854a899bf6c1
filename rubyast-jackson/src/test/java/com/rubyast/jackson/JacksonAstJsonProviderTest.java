package com.rubyast.jackson;

import com.rubyast.ast.ClassDef;
import com.rubyast.ast.Hash;
import com.rubyast.common.InvariantViolationException;
import com.rubyast.json.AstJsonException;
import com.rubyast.json.AstJsonProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    @Test
    void testDiscoveredThroughServiceLoader() {
        assertEquals(List.of("Jackson"), AstJsonProvider.availableProviders());
        AstJsonProvider provider = AstJsonProvider.getProvider();
        assertInstanceOf(JacksonAstJsonProvider.class, provider);
        assertEquals("Jackson", provider.getName());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("jackson"));
    }

    @Test
    void testUnknownProviderName() {
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
    }

    @Test
    void testRoundTripThroughProvider() {
        AstJsonProvider provider = AstJsonProvider.getProvider();
        ClassDef tree = new SampleTrees().everything();

        String pretty = provider.getSerializer().serializePretty(tree);
        assertTrue(pretty.contains("\n"));
        ClassDef back = provider.getDeserializer().deserialize(pretty, ClassDef.class);

        assertEquals(tree, back);
        assertEquals(provider.getSerializer().serialize(tree), provider.getSerializer().serialize(back));
    }

    @Test
    void testMalformedJson() {
        AstJsonProvider provider = new JacksonAstJsonProvider();
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserialize("{\"type\": \"Send\", "));
        assertEquals("Failed to deserialize Expression", e.getMessage());
        assertEquals("Expression", e.getNodeType());
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserialize("{\"type\": \"Goto\"}"));
    }

    @Test
    void testNodeInvariantsStillApply() {
        String json = """
            {"type": "Hash", "loc": {"file": 1, "beginPos": 0, "endPos": 1},
             "keys": [{"type": "Literal", "loc": {"file": 1, "beginPos": 0, "endPos": 1},
                       "value": {"kind": "Nil"}}],
             "values": []}""";
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> new JacksonAstJsonProvider().getDeserializer().deserialize(json, Hash.class));
        assertEquals("Hash", e.getNodeType());

        Throwable cause = e.getCause();
        while (cause != null && !(cause instanceof InvariantViolationException)) {
            cause = cause.getCause();
        }
        assertNotNull(cause);
    }

    @Test
    void testHandlesMustBeIntegers() {
        String json = """
            {"type": "UnresolvedIdent", "loc": {"file": 1, "beginPos": 0, "endPos": 1},
             "kind": "LOCAL", "name": "foo"}""";
        assertThrows(AstJsonException.class, () -> new JacksonAstJsonProvider().getDeserializer().deserialize(json));
    }
}
