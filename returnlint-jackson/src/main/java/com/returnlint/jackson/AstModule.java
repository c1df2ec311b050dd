package com.returnlint.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.returnlint.Diagnostic;
import com.returnlint.ast.*;

/**
 * Jackson module that configures serialization/deserialization for the tree model.
 *
 * This module handles:
 * - Polymorphic node typing through NodeMixin ("type": "Block", "Call", ...)
 * - Writing optional node parts as explicit nulls
 * - The flat diagnostic record format
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.returnlint", "returnlint-jackson"));
        addSerializer(Diagnostic.class, new DiagnosticSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);

        // Optional parts are written even when null so consumers see the shape
        context.setMixInAnnotations(Conditional.class, ConditionalMixin.class);
        context.setMixInAnnotations(Call.class, CallMixin.class);
        context.setMixInAnnotations(FunctionDefinition.class, FunctionDefinitionMixin.class);
    }

    // ==================== Type Mixin ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Block.class, name = "Block"),
        @JsonSubTypes.Type(value = Conditional.class, name = "Conditional"),
        @JsonSubTypes.Type(value = Call.class, name = "Call"),
        @JsonSubTypes.Type(value = PipeStage.class, name = "PipeStage"),
        @JsonSubTypes.Type(value = OtherExpression.class, name = "OtherExpression"),
        @JsonSubTypes.Type(value = FunctionDefinition.class, name = "FunctionDefinition")
    })
    private interface NodeMixin {
    }

    // ==================== Null Inclusion Mixins ====================

    // Mixin for Conditional - elseBranch is null for `if (cond) expr`
    private abstract static class ConditionalMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Node elseBranch();
    }

    // Mixin for Call - callee is null when it isn't a plain symbol
    private abstract static class CallMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract String callee();
    }

    // Mixin for FunctionDefinition - name is null for anonymous functions
    private abstract static class FunctionDefinitionMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract String name();
    }
}
