package com.rubyast.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.rubyast.ast.*;
import com.rubyast.core.FileRef;
import com.rubyast.core.NameRef;
import com.rubyast.core.SymbolRef;
import com.rubyast.core.TypeRef;

/**
 * Jackson module that configures serialization/deserialization for the tree records.
 *
 * This module handles:
 * - Polymorphic Expression types via NodeMixin and the "type" property
 * - Polymorphic LiteralValue types via the "kind" property
 * - Integer encoding of the NameRef/SymbolRef/TypeRef/FileRef handles
 * - Hiding derived boolean accessors (isSelf, isSymbol, ...) from the output
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.rubyast", "rubyast-jackson"));

        addSerializer(new RefSerializers.IntHandleSerializer<>(NameRef.class, NameRef::id));
        addSerializer(new RefSerializers.IntHandleSerializer<>(SymbolRef.class, SymbolRef::id));
        addSerializer(new RefSerializers.IntHandleSerializer<>(TypeRef.class, TypeRef::id));
        addSerializer(new RefSerializers.IntHandleSerializer<>(FileRef.class, FileRef::id));
        addDeserializer(NameRef.class, new RefSerializers.IntHandleDeserializer<>(NameRef.class, NameRef::new));
        addDeserializer(SymbolRef.class, new RefSerializers.IntHandleDeserializer<>(SymbolRef.class, SymbolRef::new));
        addDeserializer(TypeRef.class, new RefSerializers.IntHandleDeserializer<>(TypeRef.class, TypeRef::new));
        addDeserializer(FileRef.class, new RefSerializers.IntHandleDeserializer<>(FileRef.class, FileRef::new));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Reference.class, NodeMixin.class);
        context.setMixInAnnotations(Declaration.class, NodeMixin.class);
        context.setMixInAnnotations(LiteralValue.class, LiteralValueMixin.class);

        // Derived accessors that would otherwise be picked up as properties
        context.setMixInAnnotations(MethodDef.class, MethodDefMixin.class);
        context.setMixInAnnotations(Literal.class, LiteralMixin.class);

        // An absent block is written as null rather than dropped
        context.setMixInAnnotations(Send.class, SendMixin.class);
    }

    // ==================== Serialization Mixins ====================

    private abstract static class MethodDefMixin {
        @JsonIgnore
        abstract boolean isSelf();

        @JsonIgnore
        abstract boolean isDSLSynthesized();
    }

    private abstract static class LiteralMixin {
        @JsonIgnore
        abstract boolean isSymbol();

        @JsonIgnore
        abstract boolean isString();

        @JsonIgnore
        abstract boolean isNil();
    }

    private abstract static class SendMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Block block();
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = LiteralValue.IntegerValue.class, name = "Integer"),
        @JsonSubTypes.Type(value = LiteralValue.FloatValue.class, name = "Float"),
        @JsonSubTypes.Type(value = LiteralValue.StringValue.class, name = "String"),
        @JsonSubTypes.Type(value = LiteralValue.SymbolValue.class, name = "Symbol"),
        @JsonSubTypes.Type(value = LiteralValue.TrueValue.class, name = "True"),
        @JsonSubTypes.Type(value = LiteralValue.FalseValue.class, name = "False"),
        @JsonSubTypes.Type(value = LiteralValue.NilValue.class, name = "Nil")
    })
    private interface LiteralValueMixin {
    }

    // ==================== Node Mixin ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = ClassDef.class, name = "ClassDef"),
        @JsonSubTypes.Type(value = MethodDef.class, name = "MethodDef"),
        @JsonSubTypes.Type(value = If.class, name = "If"),
        @JsonSubTypes.Type(value = While.class, name = "While"),
        @JsonSubTypes.Type(value = Break.class, name = "Break"),
        @JsonSubTypes.Type(value = Retry.class, name = "Retry"),
        @JsonSubTypes.Type(value = Next.class, name = "Next"),
        @JsonSubTypes.Type(value = Return.class, name = "Return"),
        @JsonSubTypes.Type(value = Yield.class, name = "Yield"),
        @JsonSubTypes.Type(value = RescueCase.class, name = "RescueCase"),
        @JsonSubTypes.Type(value = Rescue.class, name = "Rescue"),
        @JsonSubTypes.Type(value = Field.class, name = "Field"),
        @JsonSubTypes.Type(value = Local.class, name = "Local"),
        @JsonSubTypes.Type(value = UnresolvedIdent.class, name = "UnresolvedIdent"),
        @JsonSubTypes.Type(value = RestArg.class, name = "RestArg"),
        @JsonSubTypes.Type(value = KeywordArg.class, name = "KeywordArg"),
        @JsonSubTypes.Type(value = OptionalArg.class, name = "OptionalArg"),
        @JsonSubTypes.Type(value = BlockArg.class, name = "BlockArg"),
        @JsonSubTypes.Type(value = ShadowArg.class, name = "ShadowArg"),
        @JsonSubTypes.Type(value = Assign.class, name = "Assign"),
        @JsonSubTypes.Type(value = Send.class, name = "Send"),
        @JsonSubTypes.Type(value = Cast.class, name = "Cast"),
        @JsonSubTypes.Type(value = Hash.class, name = "Hash"),
        @JsonSubTypes.Type(value = Array.class, name = "Array"),
        @JsonSubTypes.Type(value = Literal.class, name = "Literal"),
        @JsonSubTypes.Type(value = UnresolvedConstantLit.class, name = "UnresolvedConstantLit"),
        @JsonSubTypes.Type(value = ConstantLit.class, name = "ConstantLit"),
        @JsonSubTypes.Type(value = ZSuperArgs.class, name = "ZSuperArgs"),
        @JsonSubTypes.Type(value = Self.class, name = "Self"),
        @JsonSubTypes.Type(value = Block.class, name = "Block"),
        @JsonSubTypes.Type(value = InsSeq.class, name = "InsSeq"),
        @JsonSubTypes.Type(value = EmptyTree.class, name = "EmptyTree")
    })
    private interface NodeMixin {
    }
}
